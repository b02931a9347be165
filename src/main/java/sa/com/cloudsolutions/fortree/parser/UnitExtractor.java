package sa.com.cloudsolutions.fortree.parser;

import sa.com.cloudsolutions.fortree.depsolver.FileRecord;
import sa.com.cloudsolutions.fortree.exception.FortranParseException;

/**
 * Reads one source file and lists the program units it defines together with their raw references.
 */
public interface UnitExtractor {

    /**
     * @param filename path of the file, relative to the working directory or absolute
     * @return the record describing the file
     * @throws FortranParseException if the file cannot be read or understood
     */
    FileRecord extract(String filename) throws FortranParseException;
}
