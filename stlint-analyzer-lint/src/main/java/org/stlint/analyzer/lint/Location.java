package org.stlint.analyzer.lint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/*
Where a finding is. fileLine/fileColumn/fileEndColumn are positions in the source file; line/column/
endColumn are positions in source, the text of the routine or declaration section the finding is
in. All positions are 1-based, every component may be null.
 */
public record Location(Path file, String functionBlock, String method,
                       Integer fileLine, Integer fileColumn, Integer fileEndColumn,
                       String source, Integer line, Integer column, Integer endColumn) {
    private static final Logger LOGGER = LoggerFactory.getLogger(Location.class);

    public static final int DEFAULT_CONTEXT = 2;

    // the violating line, or null when it cannot be determined
    public String errorLine() {
        if (source != null && line != null) {
            String[] lines = source.split("\n", -1);
            return line >= 1 && line <= lines.length ? lines[line - 1] : null;
        }
        if (file != null && fileLine != null) {
            return readFileLine();
        }
        return null;
    }

    private String readFileLine() {
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            return fileLine >= 1 && fileLine <= lines.size() ? lines.get(fileLine - 1) : null;
        } catch (IOException e) {
            LOGGER.warn("Cannot read line {} of {}: {}", fileLine, file, e.getMessage());
            return null;
        }
    }

    public String pretty() {
        return pretty(DEFAULT_CONTEXT);
    }

    /*
    The position, followed by the violating line with up to maxContext lines around it and a caret
    line under the violating token. The caret line copies the tabs of the violating line, so that
    it lines up whatever the tab width.
     */
    public String pretty(int maxContext) {
        StringBuilder sb = new StringBuilder("In ").append(file == null ? "<unknown file>" : file);
        if (functionBlock != null) {
            sb.append(" in function block ").append(functionBlock);
            if (method != null) sb.append(" in method ").append(method);
        } else if (method != null) {
            sb.append(" in ").append(method);
        }
        String before;
        String after;
        Integer col;
        Integer endCol;
        if (source != null && line != null) {
            String[] lines = source.split("\n", -1);
            if (line < 1 || line > lines.length) return sb.toString();
            int start = Math.max(line - maxContext, 0);
            int end = Math.min(line + maxContext, lines.length);
            before = String.join("\n", List.of(lines).subList(start, line));
            after = line < end ? String.join("\n", List.of(lines).subList(line, end)) : null;
            col = column;
            endCol = endColumn;
            sb.append(" in line ").append(line).append(':').append(column);
        } else if (file != null && fileLine != null) {
            before = readFileLine();
            if (before == null) return sb.toString();
            after = null;
            col = fileColumn;
            endCol = fileEndColumn;
            sb.append(" in file line ").append(fileLine).append(':').append(fileColumn);
        } else {
            return sb.toString();
        }
        StringBuilder context = new StringBuilder(before);
        if (col != null) {
            int lastBreak = before.lastIndexOf('\n');
            String errorLine = before.substring(lastBreak + 1);
            context.append('\n');
            for (int i = 0; i < col - 1; i++) {
                context.append(i < errorLine.length() && errorLine.charAt(i) == '\t' ? '\t' : ' ');
            }
            context.append("^".repeat(endCol == null ? 1 : Math.max(endCol - col, 1)));
        }
        if (after != null) context.append('\n').append(after);
        return sb.append("\n\n").append(context).toString();
    }
}
