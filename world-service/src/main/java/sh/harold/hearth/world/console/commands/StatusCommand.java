package sh.harold.hearth.world.console.commands;

import org.fusesource.jansi.Ansi;
import sh.harold.hearth.world.WorldService;
import sh.harold.hearth.world.WorldServices;
import sh.harold.hearth.world.console.CommandHandler;
import sh.harold.hearth.world.console.TableFormatter;

import java.io.PrintStream;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints uptime, world counters and JVM health.
 */
public record StatusCommand(WorldService worldService) implements CommandHandler {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public StatusCommand {
        Objects.requireNonNull(worldService, "worldService");
    }

    @Override
    public boolean execute(String[] args, PrintStream out) {
        WorldServices services = worldService.services();
        Instant startedAt = worldService.startedAt();

        out.println(TableFormatter.color("=== World Status ===", Ansi.Color.CYAN));
        out.println("Uptime: " + TableFormatter.color(formatUptime(Duration.between(startedAt, Instant.now())), Ansi.Color.GREEN));
        out.println("Started: " + DATE_FORMAT.format(startedAt));
        out.println("Port: " + worldService.boundPort());
        out.println("Debug mode: " + (worldService.isDebugMode() ? "ENABLED" : "DISABLED"));
        out.println();

        out.println(TableFormatter.color("World:", Ansi.Color.YELLOW));
        out.println("  Players online: " + services.games().onlineUsers().size());
        out.println("  Accounts: " + services.accounts().size());
        out.println("  Rooms cached: " + services.rooms().index().size()
                + " (" + services.rooms().index().liveCount() + " live)");
        out.println("  Live actors: " + services.runtime().liveActorCount());
        out.println("  Supervision: living=" + services.config().livingPolicy().name().toLowerCase(Locale.ROOT)
                + ", user=" + services.config().userPolicy().name().toLowerCase(Locale.ROOT));
        out.println();

        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        out.println(TableFormatter.color("JVM:", Ansi.Color.YELLOW));
        out.println("  Memory: " + formatBytes(used) + " / " + formatBytes(runtime.maxMemory()));
        out.println("  Threads: " + ManagementFactory.getThreadMXBean().getThreadCount());
        return true;
    }

    static String formatUptime(Duration uptime) {
        long days = uptime.toDays();
        long hours = uptime.toHoursPart();
        long minutes = uptime.toMinutesPart();
        long seconds = uptime.toSecondsPart();

        StringBuilder sb = new StringBuilder();
        if (days > 0) sb.append(days).append("d ");
        if (hours > 0 || days > 0) sb.append(hours).append("h ");
        if (minutes > 0 || hours > 0 || days > 0) sb.append(minutes).append("m ");
        sb.append(seconds).append("s");
        return sb.toString();
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        int exp = (int) (Math.log(bytes) / Math.log(1024));
        char unit = "KMGTPE".charAt(exp - 1);
        return String.format("%.1f %cB", bytes / Math.pow(1024, exp), unit);
    }

    @Override
    public String getName() {
        return "status";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"stats", "info"};
    }

    @Override
    public String getDescription() {
        return "Show server status";
    }

    @Override
    public String getUsage() {
        return "status";
    }
}
