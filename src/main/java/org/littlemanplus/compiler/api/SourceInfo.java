package org.littlemanplus.compiler.api;

/**
 * A pure data class representing a position in the source code.
 *
 * @param fileName The logical name of the program.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column of the first token on the line.
 * @param lineContent The content of the line, without its line terminator.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
