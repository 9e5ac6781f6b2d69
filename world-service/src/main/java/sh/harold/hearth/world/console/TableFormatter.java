package sh.harold.hearth.world.console;

import org.fusesource.jansi.Ansi;

import java.util.ArrayList;
import java.util.List;

/**
 * Box-drawn text tables for console output.
 */
public class TableFormatter {

    private final List<String> headers = new ArrayList<>();
    private final List<Integer> widths = new ArrayList<>();
    private final List<String[]> rows = new ArrayList<>();

    public TableFormatter addHeaders(String... names) {
        for (String name : names) {
            headers.add(name);
            widths.add(name.length());
        }
        return this;
    }

    public TableFormatter addRow(String... values) {
        String[] row = new String[headers.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = i < values.length && values[i] != null ? values[i] : "";
            widths.set(i, Math.max(widths.get(i), row[i].length()));
        }
        rows.add(row);
        return this;
    }

    public int rowCount() {
        return rows.size();
    }

    public String build() {
        StringBuilder sb = new StringBuilder();
        border(sb, '┌', '┬', '┐');
        line(sb, headers.toArray(new String[0]));
        border(sb, '├', '┼', '┤');
        for (String[] row : rows) {
            line(sb, row);
        }
        border(sb, '└', '┴', '┘');
        return sb.toString();
    }

    private void border(StringBuilder sb, char left, char middle, char right) {
        sb.append(left);
        for (int i = 0; i < widths.size(); i++) {
            sb.append("─".repeat(widths.get(i) + 2));
            sb.append(i < widths.size() - 1 ? middle : right);
        }
        sb.append('\n');
    }

    private void line(StringBuilder sb, String[] values) {
        sb.append('│');
        for (int i = 0; i < widths.size(); i++) {
            String value = values[i];
            sb.append(' ').append(value).append(" ".repeat(widths.get(i) - value.length())).append(" │");
        }
        sb.append('\n');
    }

    public static String color(String text, Ansi.Color color) {
        return Ansi.ansi().fg(color).a(text).reset().toString();
    }

    public static String bold(String text) {
        return Ansi.ansi().bold().a(text).boldOff().toString();
    }
}
