package com.suitebridge.core.config;

import com.suitebridge.core.remote.RemoteConfigCodec;
import com.suitebridge.core.remote.RemoteConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses runner arguments into a {@link Configuration}.
 * <p>
 * Arguments arrive already tokenized from the host. Options that only make sense when
 * the engine drives discovery itself ({@code -s}, {@code -j}, {@code -R} and friends)
 * are rejected with a message naming the build-tool feature to use instead.
 */
public class ConfigurationBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationBuilder.class);

    private final RemoteConfigCodec remoteConfigCodec;

    public ConfigurationBuilder() {
        this(new RemoteConfigCodec());
    }

    public ConfigurationBuilder(RemoteConfigCodec remoteConfigCodec) {
        this.remoteConfigCodec = remoteConfigCodec;
    }

    public Configuration build(String[] args) {
        return build(args, new String[0]);
    }

    /**
     * Builds the configuration of a runner. When {@code remoteArgs} is non-empty the
     * runner is a forked one, and its reporter presentation comes from the parent's
     * serialized settings instead of {@code args}.
     *
     * @throws ArgumentException when an argument is malformed or unsupported
     */
    public Configuration build(String[] args, String[] remoteArgs) {
        Configuration configuration = parse(args);
        if (remoteArgs != null && remoteArgs.length > 0) {
            RemoteConfiguration remote = remoteConfigCodec.decode(remoteArgs);
            log.debug("Applying remote presentation settings {}", remote);
            configuration = remote.applyTo(configuration);
        }
        return configuration;
    }

    private Configuration parse(String[] args) {
        PresentationConfig logReporter = null;
        PresentationConfig stderrReporter = null;
        List<String> customReporters = new ArrayList<>();
        Set<String> include = new LinkedHashSet<>();
        Set<String> exclude = new LinkedHashSet<>();
        List<String> wildcardPackages = new ArrayList<>();
        List<String> membersOnlyPackages = new ArrayList<>();
        List<String> testWildcards = new ArrayList<>();
        List<String> testNames = new ArrayList<>();
        int threadCount = 1;
        Duration sortingTimeout = Configuration.DEFAULT_SORTING_TIMEOUT;
        SlowpokeSettings slowpoke = null;
        Map<String, String> configMap = new LinkedHashMap<>();

        int i = 0;
        while (i < args.length) {
            String arg = args[i];
            switch (arg) {
                case "-l" -> exclude.add(value(args, ++i, arg));
                case "-n" -> include.add(value(args, ++i, arg));
                case "-w" -> wildcardPackages.add(value(args, ++i, arg));
                case "-m" -> membersOnlyPackages.add(value(args, ++i, arg));
                case "-z" -> testWildcards.add(value(args, ++i, arg));
                case "-t" -> testNames.add(value(args, ++i, arg));
                case "-C" -> customReporters.add(value(args, ++i, arg));
                case "-T" -> sortingTimeout = Duration.ofMillis(number(value(args, ++i, arg), arg));
                case "-W" -> {
                    long delay = number(value(args, ++i, arg), arg);
                    long interval = number(value(args, ++i, arg), arg);
                    if (delay <= 0 || interval <= 0) {
                        throw new ArgumentException("-W requires a positive delay and interval, but got "
                                + delay + " and " + interval);
                    }
                    slowpoke = new SlowpokeSettings(delay, interval);
                }
                case "-s", "-i" -> throw new ArgumentException(
                        "Specifying a suite (-s <suite>) or nested suite (-i <nested suite>) is not supported"
                                + " when running Suitebridge from a build tool, please use the build tool's"
                                + " test selection instead.");
                case "-j" -> throw new ArgumentException(
                        "Running JUnit tests (-j <junit>) is not supported when running Suitebridge from a"
                                + " build tool.");
                case "-b" -> throw new ArgumentException(
                        "Running TestNG tests (-b <testng>) is not supported when running Suitebridge from a"
                                + " build tool.");
                case "-R" -> throw new ArgumentException(
                        "Specifying a runpath (-R <runpath>) is not supported when running Suitebridge from a"
                                + " build tool.");
                case "-A" -> throw new ArgumentException(
                        "Run again (-A) is not supported when running Suitebridge from a build tool, please"
                                + " use the build tool's quick test re-run instead.");
                case "-q" -> throw new ArgumentException(
                        "Discovery suffixes (-q) is not supported when running Suitebridge from a build tool,"
                                + " please use the build tool's test filter instead.");
                default -> {
                    if (arg.startsWith("-P")) {
                        threadCount = threadCount(arg);
                    } else if (arg.startsWith("-o")) {
                        if (logReporter == null) {
                            logReporter = PresentationConfig.parse("-o", arg.substring(2));
                        } else {
                            log.debug("Ignoring repeated {}", arg);
                        }
                    } else if (arg.startsWith("-e")) {
                        if (stderrReporter == null) {
                            stderrReporter = PresentationConfig.parse("-e", arg.substring(2));
                        } else {
                            log.debug("Ignoring repeated {}", arg);
                        }
                    } else if (arg.startsWith("-D")) {
                        putConfigEntry(configMap, arg);
                    } else {
                        throw new ArgumentException("Unrecognized argument: " + arg);
                    }
                }
            }
            i++;
        }

        return new Configuration(
                logReporter != null ? logReporter : PresentationConfig.defaults(),
                Optional.ofNullable(stderrReporter),
                customReporters,
                include,
                exclude,
                wildcardPackages,
                membersOnlyPackages,
                testWildcards,
                testNames,
                threadCount,
                sortingTimeout,
                Optional.ofNullable(slowpoke),
                configMap
        );
    }

    private static int threadCount(String arg) {
        if (arg.equals("-P")) {
            throw new ArgumentException("-P without specifying <numthreads> is not supported when running"
                    + " Suitebridge from a build tool, please use the build tool's parallel configuration"
                    + " instead.");
        }
        if (arg.equals("-PS")) {
            throw new ArgumentException("-PS is not supported when running Suitebridge from a build tool,"
                    + " please use the build tool's parallel and buffered logging configuration instead.");
        }
        String count = arg.substring(2);
        int threads;
        try {
            threads = Integer.parseInt(count);
        } catch (NumberFormatException e) {
            throw new ArgumentException("-P requires a numeric thread count, but got: " + count, e);
        }
        if (threads <= 0) {
            throw new ArgumentException("-P with negative or zero thread number is invalid, please pass in"
                    + " a positive thread number instead.");
        }
        return threads;
    }

    private static void putConfigEntry(Map<String, String> configMap, String arg) {
        String entry = arg.substring(2);
        int eq = entry.indexOf('=');
        if (eq <= 0) {
            throw new ArgumentException("-D requires <key>=<value>, but got: " + arg);
        }
        configMap.put(entry.substring(0, eq), entry.substring(eq + 1));
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new ArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static long number(String value, String option) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ArgumentException(option + " requires a number, but got: " + value, e);
        }
    }
}
