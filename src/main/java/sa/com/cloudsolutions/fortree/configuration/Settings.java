package sa.com.cloudsolutions.fortree.configuration;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.FileNotFoundException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages the configuration properties from the fortree.yml file.
 */
public class Settings {
    /**
     * List of directories making up the source tree.
     */
    public static final String TREE = "tree";
    /**
     * Location of the json document describing the tree.
     */
    public static final String DESC_TREE_FILE = "desc_tree_file";
    public static final String EXCLUDED_EXTENSIONS = "excluded_extensions";
    public static final String DOT_COMMAND = "graphviz.dot";

    private static final String VARIABLES = "variables";
    private static final String DEFAULT_CONFIG = "fortree.yml";
    private static final List<String> DEFAULT_EXCLUDED_EXTENSIONS = List.of("", ".json", ".fypp", ".txt");

    /**
     * HashMap to store the configurations.
     */
    protected static HashMap<String, Object> props;

    private Settings() {}

    /**
     * Load the configuration from the default fortree.yml file on the class path.
     * @throws IOException if the file could not be read.
     */
    public static void loadConfigMap() throws IOException {
        if (props == null) {
            try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
                if (in == null) {
                    throw new FileNotFoundException(DEFAULT_CONFIG);
                }
                props = new HashMap<>();
                loadYamlConfig(mapper().readValue(in, new TypeReference<Map<String, Object>>() {}));
            }
        }
    }

    public static void loadConfigMap(File f) throws IOException {
        props = new HashMap<>();
        loadYamlConfig(mapper().readValue(f, new TypeReference<Map<String, Object>>() {}));
    }

    private static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new SimpleModule().addDeserializer(Map.class, new LinkedHashMapDeserializer()));
        return mapper;
    }

    /**
     * Load configuration from the parsed yaml document.
     *
     * Values may refer to entries of the optional <code>variables</code> section as well as to
     * environment variables, both with the ${NAME} syntax.
     * @param yamlProps the raw content of the yaml file
     */
    @SuppressWarnings("unchecked")
    private static void loadYamlConfig(Map<String, Object> yamlProps) {
        Map<String, Object> variables = (Map<String, Object>) yamlProps.getOrDefault(VARIABLES, new HashMap<>());
        if (variables == null) {
            variables = new HashMap<>();
        }
        variables.replaceAll((k, value) -> replaceEnvVariables(String.valueOf(value)));
        props.put(VARIABLES, variables);

        replaceVariables(yamlProps, props);
    }

    /**
     * Replace variables from the yaml file with environment or internal variables
     *
     * @param source the source from which we will copy the data
     * @param target the destination where we will put the data
     */
    @SuppressWarnings("unchecked")
    private static void replaceVariables(Map<String, Object> source, Map<String, Object> target) {
        String userDir = System.getProperty("user.home");

        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value != null && !key.equals(VARIABLES)) {
                if (value instanceof Map) {
                    Map<String, Object> nestedMap = new HashMap<>();
                    replaceVariables((Map<String, Object>) value, nestedMap);
                    target.put(key, nestedMap);
                } else if (value instanceof List<?> list) {
                    List<String> result = new ArrayList<>();
                    for (Object o : list) {
                        String s = String.valueOf(o).replace("${USERDIR}", userDir);
                        result.add(replaceEnvVariables(replaceYamlVariables(s)));
                    }
                    target.put(key, result);
                } else if (value instanceof String v) {
                    v = v.replace("${USERDIR}", userDir);
                    v = replaceYamlVariables(v);
                    target.put(key, replaceEnvVariables(v));
                } else {
                    target.put(key, value);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static String replaceYamlVariables(String value) {
        Map<String, Object> variablesMap = (Map<String, Object>) props.get(VARIABLES);
        for (Map.Entry<String, Object> variable : variablesMap.entrySet()) {
            String key = "${" + variable.getKey() + "}";
            value = value.replace(key, String.valueOf(variable.getValue()));
        }
        return value;
    }

    /**
     * The value is checked for an environment variable and replaced if found.
     * The format is ${ENV_VAR_NAME}. Unknown variables are replaced by an empty string.
     *
     * @param value the configuration that needs to be searched for env variables
     * @return the value with the env variables replaced
     */
    private static String replaceEnvVariables(String value) {
        int startIndex;
        while ((startIndex = value.indexOf("${")) != -1) {
            int endIndex = value.indexOf("}", startIndex);
            if (endIndex == -1) {
                break;
            }
            String envVar = value.substring(startIndex + 2, endIndex);
            String envValue = System.getenv(envVar);
            if (envValue != null) {
                value = value.substring(0, startIndex) + envValue + value.substring(endIndex + 1);
            } else {
                value = value.substring(0, startIndex) + value.substring(endIndex + 1);
            }
        }
        return value;
    }

    /**
     * Get the property value for the given key.
     * The cls parameter is used to cast the result to the given class so that the callers
     * need not clutter their call with casts
     *
     * @param key the key to search for
     * @param cls try to map the result to this class
     * @return an optional with the result if it's found
     */
    public static <T> Optional<T> getProperty(String key, Class<T> cls) {
        Object property = getProperty(key);
        if (property != null) {
            return Optional.of(cls.cast(property));
        }
        return Optional.empty();
    }

    public static Object getProperty(String key) {
        if (props == null) {
            return null;
        }
        Object property = props.get(key);
        if (property != null) {
            return property;
        }
        String[] parts = key.split("\\.");
        if (parts.length > 1) {
            Object result = props.get(parts[0]);
            if (result instanceof Map<?, ?> map) {
                return map.get(parts[1]);
            }
        }
        return null;
    }

    /**
     * A property that may be given either as a yaml list or as a comma separated string.
     */
    public static <T> Collection<T> getPropertyList(String key, Class<T> cls) {
        Object property = getProperty(key);
        List<T> result = new ArrayList<>();
        if (property instanceof List<?> list) {
            for (Object o : list) {
                result.add(cls.cast(o));
            }
        } else if (property instanceof String s && !s.isBlank()) {
            for (String part : s.split(",")) {
                result.add(cls.cast(part.strip()));
            }
        }
        return result;
    }

    public static List<String> getTree() {
        return new ArrayList<>(getPropertyList(TREE, String.class));
    }

    public static String getDescTreeFile() {
        return getProperty(DESC_TREE_FILE, String.class).orElse(null);
    }

    public static List<String> getExcludedExtensions() {
        if (getProperty(EXCLUDED_EXTENSIONS) == null) {
            return DEFAULT_EXCLUDED_EXTENSIONS;
        }
        return new ArrayList<>(getPropertyList(EXCLUDED_EXTENSIONS, String.class));
    }

    public static String getDotCommand() {
        return getProperty(DOT_COMMAND, String.class).orElse("dot");
    }

    public static class LinkedHashMapDeserializer extends JsonDeserializer<Map<String, Object>> {
        @Override
        @SuppressWarnings("unchecked")
        public Map<String, Object> deserialize(JsonParser p, DeserializationContext ctxt)
                throws IOException {
            return p.readValueAs(LinkedHashMap.class);
        }
    }
}
