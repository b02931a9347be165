package sa.com.cloudsolutions.fortree.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.fortree.depsolver.FileRecord;
import sa.com.cloudsolutions.fortree.depsolver.ScopeKind;
import sa.com.cloudsolutions.fortree.depsolver.ScopePath;
import sa.com.cloudsolutions.fortree.depsolver.UseStatement;
import sa.com.cloudsolutions.fortree.exception.FortranParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line oriented extractor for Fortran sources.
 *
 * <p>
 * This is not a full parser. Statements are reassembled from physical lines (free or fixed
 * form, continuation lines, semicolons, comments) and classified with regular expressions,
 * which is enough to know the program units of a file and what each of them includes, uses
 * and calls. References made by a unit do not include those of the procedures it contains.
 * </p>
 *
 * <p>
 * Names followed by a parenthesis in executable statements may be function calls or array
 * references. Names declared as arrays in the unit (or in an enclosing unit) are left out,
 * the others are reported as ambiguous references.
 * </p>
 */
public class FortranUnitExtractor implements UnitExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FortranUnitExtractor.class);

    private static final Set<String> FIXED_FORM_EXTENSIONS = Set.of(".f", ".for", ".ftn", ".f77");
    // columns 73 and beyond hold sequence numbers
    private static final int FIXED_FORM_WIDTH = 72;

    private static final Pattern CPP_INCLUDE = Pattern.compile("^#\\s*include\\s*[\"<]([^\">]+)[\">]");
    private static final Pattern LABEL = Pattern.compile("^\\d+\\s+");
    private static final Pattern CONSTRUCT_NAME = Pattern.compile("^[A-Z_]\\w*\\s*:(?!:)\\s*(?=[A-Z])");

    private static final Pattern END_UNIT = Pattern.compile(
            "^END\\s*(SUBROUTINE|FUNCTION|SUBMODULE|MODULE|PROGRAM|INTERFACE|TYPE|BLOCK\\s*DATA|PROCEDURE)\\b(.*)$");
    private static final Pattern MODULE = Pattern.compile("^MODULE\\s+(\\w+)$");
    private static final Pattern SUBMODULE = Pattern.compile("^SUBMODULE\\s*\\([^)]*\\)\\s*(\\w+)$");
    private static final Pattern PROGRAM = Pattern.compile("^PROGRAM\\s+(\\w+)$");
    private static final Pattern BLOCK_DATA = Pattern.compile("^BLOCK\\s*DATA(?:\\s+(\\w+))?$");
    private static final Pattern INTERFACE = Pattern.compile("^(ABSTRACT\\s+)?INTERFACE\\b\\s*(.*)$");
    private static final Pattern TYPE_DEFINITION = Pattern.compile(
            "^TYPE\\s*(?:,[^:]*)?::\\s*(\\w+)|^TYPE\\s+(?!IS\\b)(\\w+)$");
    private static final String PREFIX =
            "(?:(?:RECURSIVE|NON_RECURSIVE|PURE|IMPURE|ELEMENTAL|MODULE"
            + "|INTEGER|REAL|LOGICAL|COMPLEX|CHARACTER|DOUBLE\\s*PRECISION|DOUBLE\\s*COMPLEX|TYPE|CLASS)"
            + "\\s*(?:\\*\\s*\\d+|\\([^)]*\\))?\\s*)*";
    private static final Pattern SUBROUTINE = Pattern.compile("^" + PREFIX + "SUBROUTINE\\s+(\\w+)");
    private static final Pattern FUNCTION = Pattern.compile("^" + PREFIX + "FUNCTION\\s+(\\w+)\\s*\\(");
    private static final Pattern SEPARATE_PROCEDURE = Pattern.compile("^MODULE\\s+PROCEDURE\\s+(\\w+)$");
    private static final Pattern PROCEDURE_BINDING = Pattern.compile("^(?:MODULE\\s+)?PROCEDURE\\b\\s*(?:::)?\\s*(.*)$");

    private static final Pattern USE = Pattern.compile(
            "^USE\\b\\s*(?:,\\s*(?:NON_)?INTRINSIC\\s*)?(?:::)?\\s*(\\w+)\\s*(?:,\\s*(.*))?$");
    private static final Pattern ONLY = Pattern.compile("^ONLY\\s*:(.*)$");
    private static final Pattern INCLUDE = Pattern.compile("^INCLUDE\\s*(['\"])(.*?)\\1", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALL = Pattern.compile("(?:^|\\)\\s*)CALL\\s+(\\w+)\\b(?!\\s*%)");
    private static final Pattern REFERENCE = Pattern.compile("(?<![%\\w.])([A-Z_]\\w*)\\s*\\(");
    private static final Pattern NAME = Pattern.compile("[A-Z_]\\w*");

    private static final Pattern DECLARATION = Pattern.compile(
            "^(?:INTEGER|REAL|LOGICAL|COMPLEX|CHARACTER|DOUBLE\\s*PRECISION|DOUBLE\\s*COMPLEX"
            + "|TYPE\\s*\\(|CLASS\\s*\\(|PROCEDURE\\s*\\(|DIMENSION|ALLOCATABLE|POINTER|TARGET|PARAMETER"
            + "|SAVE|DATA|COMMON|EQUIVALENCE|NAMELIST|EXTERNAL|INTRINSIC|OPTIONAL|INTENT|PUBLIC|PRIVATE"
            + "|PROTECTED|VOLATILE|ASYNCHRONOUS|VALUE|SEQUENCE|ENUMERATOR|ENUM|GENERIC|FINAL|IMPORT)\\b");
    private static final Pattern TYPE_SPEC = Pattern.compile(
            "^(?:(?:INTEGER|REAL|LOGICAL|COMPLEX|CHARACTER|DOUBLE\\s*PRECISION|DOUBLE\\s*COMPLEX)"
            + "\\s*(?:\\*\\s*\\d+|\\*\\s*\\([^)]*\\)|\\((?:[^()]|\\([^)]*\\))*\\))?"
            + "|(?:TYPE|CLASS)\\s*\\([^)]*\\)|DIMENSION)\\s*(.*)$");
    private static final Pattern SKIPPED = Pattern.compile("^(?:CONTAINS|IMPLICIT|FORMAT)\\b");

    private static final Set<String> KEYWORDS = Set.of(
            "IF", "ELSEIF", "THEN", "WHILE", "DO", "SELECT", "SELECTCASE", "CASE", "WHERE", "ELSEWHERE",
            "FORALL", "ALLOCATE", "DEALLOCATE", "NULLIFY", "READ", "WRITE", "PRINT", "OPEN", "CLOSE",
            "INQUIRE", "REWIND", "BACKSPACE", "ENDFILE", "FLUSH", "WAIT", "RETURN", "STOP", "CALL",
            "GOTO", "ASSOCIATE", "BLOCK", "CRITICAL", "KIND", "LEN", "RESULT", "BIND", "TYPE", "CLASS",
            "IS", "DEFAULT", "RANK", "ERROR", "SYNC", "CONCURRENT", "INTEGER", "REAL", "LOGICAL",
            "COMPLEX", "CHARACTER", "DIMENSION", "INTENT");

    /**
     * An open program unit while walking through the statements.
     */
    private static final class OpenScope {
        final ScopePath path;
        final Set<String> arrays = new HashSet<>();
        final List<String> bindings = new ArrayList<>();

        OpenScope(ScopePath path) {
            this.path = path;
        }

        ScopeKind kind() {
            return path.getKind();
        }
    }

    /**
     * One logical statement.
     *
     * @param line physical line where the statement starts
     * @param text the statement with comments removed
     * @param code upper case copy of the text with string literals emptied
     */
    record Statement(int line, String text, String code) {}

    @Override
    public FileRecord extract(String filename) throws FortranParseException {
        String content;
        try {
            content = Files.readString(Path.of(filename), StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new FortranParseException(filename, "cannot be read", e);
        }
        return extract(filename, content);
    }

    /**
     * Analyses the given source text as if it was the content of the named file.
     */
    public FileRecord extract(String filename, String content) throws FortranParseException {
        FileRecord.Builder builder = FileRecord.builder(filename);
        Deque<OpenScope> stack = new ArrayDeque<>();
        List<OpenScope> interfaces = new ArrayList<>();

        for (Statement statement : statements(content, isFixedForm(filename))) {
            handle(filename, statement, stack, interfaces, builder);
        }
        if (!stack.isEmpty()) {
            throw new FortranParseException(filename, "end of file reached while " + stack.peek().path + " is still open");
        }

        addInterfaceBindings(builder, interfaces);
        return builder.build();
    }

    static boolean isFixedForm(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && FIXED_FORM_EXTENSIONS.contains(filename.substring(dot).toLowerCase(Locale.ROOT));
    }

    private void handle(String filename, Statement statement, Deque<OpenScope> stack, List<OpenScope> interfaces,
                        FileRecord.Builder builder) throws FortranParseException {
        String code = statement.code();
        OpenScope current = stack.peek();

        Matcher m = END_UNIT.matcher(code);
        if (code.equals("END") || m.matches()) {
            closeScope(filename, statement, m.matches() ? m.group(1) : null, stack);
            return;
        }

        Optional<OpenScope> opened = openScope(code, current);
        if (opened.isPresent()) {
            OpenScope scope = opened.get();
            builder.unit(scope.path);
            stack.push(scope);
            if (scope.kind() == ScopeKind.INTERFACE) {
                interfaces.add(scope);
            }
            return;
        }

        if (SKIPPED.matcher(code).find()) {
            return;
        }
        if (current == null) {
            logger.debug("{}:{} statement outside of any program unit ignored", filename, statement.line());
            return;
        }
        if (current.kind() == ScopeKind.INTERFACE) {
            m = PROCEDURE_BINDING.matcher(code);
            if (m.matches()) {
                current.bindings.addAll(names(m.group(1)));
            }
            return;
        }

        m = USE.matcher(code);
        if (m.matches()) {
            builder.use(current.path, useStatement(m.group(1), m.group(2)));
            return;
        }
        m = INCLUDE.matcher(statement.text().strip());
        if (m.find()) {
            builder.include(current.path, m.group(2));
            return;
        }
        if (DECLARATION.matcher(code).find()) {
            current.arrays.addAll(declaredArrays(code));
            return;
        }
        references(code, stack, current, builder);
    }

    private Optional<OpenScope> openScope(String code, OpenScope current) {
        Matcher m;
        if ((m = MODULE.matcher(code)).matches()) {
            return Optional.of(open(current, ScopeKind.MODULE, m.group(1)));
        }
        if ((m = SUBMODULE.matcher(code)).matches()) {
            return Optional.of(open(current, ScopeKind.SUBMODULE, m.group(1)));
        }
        if ((m = PROGRAM.matcher(code)).matches()) {
            return Optional.of(open(current, ScopeKind.PROGRAM, m.group(1)));
        }
        if ((m = BLOCK_DATA.matcher(code)).matches()) {
            return Optional.of(open(current, ScopeKind.BLOCK_DATA, m.group(1) == null ? ScopePath.UNKNOWN_NAME : m.group(1)));
        }
        if ((m = INTERFACE.matcher(code)).matches()) {
            String name = m.group(2).strip();
            boolean named = m.group(1) == null && NAME.matcher(name).matches();
            return Optional.of(open(current, ScopeKind.INTERFACE, named ? name : ScopePath.UNKNOWN_NAME));
        }
        if ((m = TYPE_DEFINITION.matcher(code)).find()) {
            return Optional.of(open(current, ScopeKind.TYPE, m.group(1) != null ? m.group(1) : m.group(2)));
        }
        if (current == null || current.kind() != ScopeKind.INTERFACE) {
            if ((m = SEPARATE_PROCEDURE.matcher(code)).matches()) {
                return Optional.of(open(current, ScopeKind.SUBROUTINE, m.group(1)));
            }
        }
        if ((m = SUBROUTINE.matcher(code)).find()) {
            return Optional.of(open(current, ScopeKind.SUBROUTINE, m.group(1)));
        }
        if ((m = FUNCTION.matcher(code)).find()) {
            return Optional.of(open(current, ScopeKind.FUNCTION, m.group(1)));
        }
        return Optional.empty();
    }

    private static OpenScope open(OpenScope current, ScopeKind kind, String name) {
        return new OpenScope(current == null ? ScopePath.of(kind, name) : current.path.child(kind, name));
    }

    private void closeScope(String filename, Statement statement, String keyword, Deque<OpenScope> stack)
            throws FortranParseException {
        if (stack.isEmpty()) {
            throw new FortranParseException(filename, "line " + statement.line() + ": END without any open program unit");
        }
        OpenScope top = stack.peek();
        if (keyword != null) {
            ScopeKind expected = switch (keyword.replaceAll("\\s", "")) {
                case "SUBROUTINE", "PROCEDURE" -> ScopeKind.SUBROUTINE;
                case "FUNCTION" -> ScopeKind.FUNCTION;
                case "MODULE" -> ScopeKind.MODULE;
                case "SUBMODULE" -> ScopeKind.SUBMODULE;
                case "PROGRAM" -> ScopeKind.PROGRAM;
                case "INTERFACE" -> ScopeKind.INTERFACE;
                case "TYPE" -> ScopeKind.TYPE;
                default -> ScopeKind.BLOCK_DATA;
            };
            boolean separateFunction = keyword.equals("PROCEDURE") && top.kind() == ScopeKind.FUNCTION;
            if (expected != top.kind() && !separateFunction) {
                throw new FortranParseException(filename, "line " + statement.line() + ": " + statement.text().strip()
                        + " does not close " + top.path);
            }
        }
        stack.pop();
    }

    /**
     * MODULE PROCEDURE statements of an interface name procedures defined next to the interface.
     * Each of them is registered as a member of the interface.
     */
    private void addInterfaceBindings(FileRecord.Builder builder, List<OpenScope> interfaces) {
        List<ScopePath> units = new ArrayList<>(builder.getUnits());
        for (OpenScope itf : interfaces) {
            Optional<ScopePath> parent = itf.path.parent();
            for (String name : itf.bindings) {
                for (ScopePath unit : units) {
                    if (unit.getName().equals(name) && unit.parent().equals(parent)
                            && unit.getKind() != ScopeKind.INTERFACE && unit.getKind() != ScopeKind.TYPE) {
                        builder.unit(itf.path.child(unit.getKind(), name));
                    }
                }
            }
        }
    }

    private UseStatement useStatement(String module, String rest) {
        if (rest == null) {
            return new UseStatement(module);
        }
        Matcher only = ONLY.matcher(rest.strip());
        if (!only.matches()) {
            // renaming without ONLY still imports the whole module
            return new UseStatement(module);
        }
        Set<String> names = new LinkedHashSet<>();
        for (String item : splitTopLevel(only.group(1))) {
            String s = item.strip();
            if (s.startsWith("OPERATOR") || s.startsWith("ASSIGNMENT")) {
                continue;
            }
            names.addAll(names(s));
        }
        return new UseStatement(module, names);
    }

    private void references(String code, Deque<OpenScope> stack, OpenScope current, FileRecord.Builder builder) {
        Set<Integer> callPositions = new HashSet<>();
        Matcher call = CALL.matcher(code);
        while (call.find()) {
            builder.call(current.path, call.group(1));
            callPositions.add(call.start(1));
        }

        Matcher ref = REFERENCE.matcher(code);
        while (ref.find()) {
            String name = ref.group(1);
            if (callPositions.contains(ref.start(1)) || KEYWORDS.contains(name) || isArray(name, stack)) {
                continue;
            }
            builder.ambiguousRef(current.path, name);
        }
    }

    private static boolean isArray(String name, Deque<OpenScope> stack) {
        for (OpenScope scope : stack) {
            if (scope.arrays.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Names declared with an array specification by a declaration statement.
     */
    static Set<String> declaredArrays(String code) {
        Set<String> result = new HashSet<>();
        String attributes;
        String entities;
        int colons = code.indexOf("::");
        if (colons >= 0) {
            attributes = code.substring(0, colons);
            entities = code.substring(colons + 2);
        } else {
            Matcher m = TYPE_SPEC.matcher(code);
            if (!m.matches()) {
                return result;
            }
            attributes = code.substring(0, m.start(1));
            entities = m.group(1);
        }
        boolean dimensioned = attributes.contains("DIMENSION");
        for (String entity : splitTopLevel(entities)) {
            String e = entity.strip();
            Matcher name = NAME.matcher(e);
            if (!name.lookingAt()) {
                continue;
            }
            String rest = e.substring(name.end()).stripLeading();
            if (dimensioned || rest.startsWith("(")) {
                result.add(name.group());
            }
        }
        return result;
    }

    private static List<String> names(String list) {
        List<String> result = new ArrayList<>();
        Matcher m = NAME.matcher(list);
        while (m.find()) {
            result.add(m.group());
        }
        return result;
    }

    /**
     * Splits on the commas that are not nested in parentheses.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * Rebuilds the logical statements from the physical lines.
     */
    static List<Statement> statements(String content, boolean fixedForm) {
        List<Statement> result = new ArrayList<>();
        String[] lines = content.split("\\r?\\n", -1);
        StringBuilder pending = null;
        int pendingLine = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.strip();
            if (trimmed.startsWith("#")) {
                Matcher m = CPP_INCLUDE.matcher(trimmed);
                if (m.find()) {
                    String target = m.group(1).strip();
                    result.add(new Statement(i + 1, "INCLUDE '" + target + "'", "INCLUDE ''"));
                }
                continue;
            }

            if (fixedForm) {
                if (line.isEmpty() || "Cc*!".indexOf(line.charAt(0)) >= 0) {
                    continue;
                }
                String body = stripComment(line.length() > FIXED_FORM_WIDTH ? line.substring(0, FIXED_FORM_WIDTH) : line);
                if (body.isBlank()) {
                    continue;
                }
                boolean continuation = body.length() > 5 && !body.startsWith("\t")
                        && body.charAt(5) != ' ' && body.charAt(5) != '0';
                if (continuation && pending != null) {
                    pending.append(body.substring(6));
                } else {
                    flush(pending, pendingLine, result);
                    pending = new StringBuilder(body.strip());
                    pendingLine = i + 1;
                }
                continue;
            }

            String body = stripComment(line).strip();
            if (body.isEmpty()) {
                continue;
            }
            if (pending != null && pending.length() > 0 && body.startsWith("&")) {
                body = body.substring(1);
            }
            if (pending == null) {
                pending = new StringBuilder();
                pendingLine = i + 1;
            }
            if (body.endsWith("&")) {
                pending.append(body, 0, body.length() - 1);
            } else {
                pending.append(body);
                flush(pending, pendingLine, result);
                pending = null;
            }
        }
        flush(pending, pendingLine, result);
        return result;
    }

    private static void flush(StringBuilder pending, int line, List<Statement> result) {
        if (pending == null) {
            return;
        }
        for (String part : splitStatements(pending.toString())) {
            String text = part.strip();
            if (!text.isEmpty()) {
                String code = mask(text).toUpperCase(Locale.ROOT).strip();
                code = LABEL.matcher(code).replaceFirst("");
                code = CONSTRUCT_NAME.matcher(code).replaceFirst("");
                result.add(new Statement(line, LABEL.matcher(text).replaceFirst(""), code));
            }
        }
    }

    /**
     * Removes a trailing <code>!</code> comment, ignoring the ones inside string literals.
     */
    static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '!') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private static List<String> splitStatements(String text) {
        List<String> parts = new ArrayList<>();
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == ';') {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * Empties the string literals so that their content is never mistaken for code.
     */
    static String mask(String text) {
        StringBuilder b = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                    b.append(c);
                }
            } else {
                if (c == '\'' || c == '"') {
                    quote = c;
                }
                b.append(c);
            }
        }
        return b.toString();
    }
}
