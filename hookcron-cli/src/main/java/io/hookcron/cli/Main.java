package io.hookcron.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static io.hookcron.cli.ConfigUtil.defaultConfigPath;
import static io.hookcron.cli.SystemExitException.systemExit;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "hookcron";

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err, InputStream in)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.in = in;
        this.programName = System.getProperty("io.hookcron.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-c", "--config"})
        protected String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err, System.in).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    private static final Map<String, Class<? extends Command>> COMMANDS = ImmutableMap.<String, Class<? extends Command>>builder()
        .put("server", Server.class)
        .put("tick", Tick.class)
        .put("migrate", Migrate.class)
        .put("create", Create.class)
        .put("schedules", ShowSchedules.class)
        .put("schedule", ShowSchedule.class)
        .put("reset", Reset.class)
        .put("enable", EnableSchedule.class)
        .put("disable", DisableSchedule.class)
        .put("delete", Delete.class)
        .build();

    private static final Set<String> QUIET_LEVELS = ImmutableSet.of("error", "warn", "info");
    private static final Set<String> VERBOSE_LEVELS = ImmutableSet.of("debug", "trace");

    public int cli(String... args)
    {
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        MainOptions mainOpts = new MainOptions();
        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);

        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(InputStream.class).annotatedWith(StdIn.class).toInstance(in);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
            }
        });

        // @file arguments are not expanded
        jc.setExpandAtSign(false);
        for (Map.Entry<String, Class<? extends Command>> command : COMMANDS.entrySet()) {
            jc.addCommand(command.getKey(), injector.getInstance(command.getValue()));
        }
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            if (mainOpts.help) {
                throw usage(null);
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(mainOpts, command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.isError()) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = formatExceptionMessage(ex);
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                err.println("error: " + message);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private boolean processCommonOptions(MainOptions mainOpts, Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        if (!QUIET_LEVELS.contains(command.logLevel) && !VERBOSE_LEVELS.contains(command.logLevel)) {
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        if (command.configPath == null) {
            command.configPath = mainOpts.configPath;
        }

        configureLogging(command.logLevel, command.logPath);

        return VERBOSE_LEVELS.contains(command.logLevel);
    }

    private static void configureLogging(String level, String logPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // substituted into the logback XML
        Level lv = Level.toLevel(level.toUpperCase(Locale.ENGLISH), Level.INFO);
        System.setProperty("hookcron.log.level", lv.toString());

        String name;
        if (logPath.equals("-")) {
            name = "/hookcron/cli/logback-console.xml";
        }
        else {
            System.setProperty("hookcron.log.path", logPath);
            name = "/hookcron/cli/logback-file.xml";
        }
        try {
            configurator.doConfigure(Main.class.getResource(name));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    /**
     * Joins the messages of an exception and its causes, skipping a cause whose
     * message is already included.
     */
    static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        Set<String> seen = new HashSet<>();
        for (Throwable t : Throwables.getCausalChain(ex)) {
            String message = t.getMessage();
            if (message == null || message.trim().isEmpty()) {
                continue;
            }
            if (sb.indexOf(message) >= 0 || !seen.add(message)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(message);
        }
        if (sb.length() == 0) {
            sb.append(ex.getClass().getSimpleName());
        }
        return sb.toString();
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Dispatcher commands:");
        err.println("    server                             poll and deliver due schedules until stopped");
        err.println("    tick                               deliver due schedules once and exit");
        err.println("    migrate (run|check)                migrate database");
        err.println("");
        err.println("  Schedule commands:");
        err.println("    create --owner ID --name NAME ...  create a schedule");
        err.println("    schedules                          show schedules");
        err.println("    schedule <id>                      show a schedule and its recent executions");
        err.println("    reset <id>                         make a schedule due now");
        err.println("    enable <id>                        enable a schedule");
        err.println("    disable <id>                       disable a schedule");
        err.println("    delete <id>                        delete a schedule");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     add a system config");
        err.println("    -c, --config PATH.properties     Configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("");
    }
}
