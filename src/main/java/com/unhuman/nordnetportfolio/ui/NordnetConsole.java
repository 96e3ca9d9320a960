package com.unhuman.nordnetportfolio.ui;

import com.unhuman.nordnetportfolio.core.AuthFlowException;
import com.unhuman.nordnetportfolio.core.AuthenticationFailedException;
import com.unhuman.nordnetportfolio.core.AuthenticationService;
import com.unhuman.nordnetportfolio.core.ConfigManager;
import com.unhuman.nordnetportfolio.core.HttpSessionFactory;
import com.unhuman.nordnetportfolio.core.LoginHandle;
import com.unhuman.nordnetportfolio.core.NordnetApiException;
import com.unhuman.nordnetportfolio.core.NordnetClient;
import com.unhuman.nordnetportfolio.core.ProgressChannel;
import com.unhuman.nordnetportfolio.core.ProgressChannel.ProgressEvent;
import com.unhuman.nordnetportfolio.core.SessionManager;
import com.unhuman.nordnetportfolio.core.SessionStore;
import com.unhuman.nordnetportfolio.model.Credentials;
import com.unhuman.nordnetportfolio.model.SessionArtifact;
import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Command-line front end: reuses or creates a Nordnet session and prints the accounts.
 * The login runs on a worker thread; its progress and the CPR prompt are handled here on the
 * main thread. Ctrl+C cancels a login in progress.
 */
public class NordnetConsole {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final ConfigManager configManager;
    private final BufferedReader in;
    private final PrintStream out;
    // built in run(), once the configuration has been validated
    private HttpSessionFactory httpSessionFactory;
    private AuthenticationService authenticationService;
    private SessionManager sessionManager;
    private volatile LoginHandle activeLogin;
    private volatile boolean loggedIn;

    public NordnetConsole(ConfigManager configManager, BufferedReader in, PrintStream out) {
        this.configManager = configManager;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage(System.err);
            System.exit(EXIT_USAGE);
            return;
        }
        if (options.help) {
            printUsage(System.out);
            return;
        }

        LogManager.getInstance().setVerbose(options.verbose);
        LogManager.getInstance().setEchoToConsole(options.verbose);
        ConfigManager configManager = new ConfigManager(
                options.configPath != null ? options.configPath : ConfigManager.defaultConfigPath());
        configManager.loadConfiguration();
        options.applyTo(configManager);

        NordnetConsole console = new NordnetConsole(configManager,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        Runtime.getRuntime().addShutdownHook(new Thread(console::cancelActiveLogin, "LoginCancel"));
        System.exit(console.run(options));
    }

    int run(Options options) {
        try {
            configManager.validate();
        } catch (IllegalStateException e) {
            out.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        String userId = configManager.getUserId();
        if (userId == null || userId.isBlank()) {
            out.println("No MitID user id given; use --user or set userId in " + ConfigManager.defaultConfigPath());
            return EXIT_USAGE;
        }

        httpSessionFactory = new HttpSessionFactory(configManager);
        SessionStore sessionStore = new SessionStore(configManager.getSessionFile(), httpSessionFactory.newClient(),
                configManager.getBrokerBaseUrl());
        authenticationService = new AuthenticationService(configManager, httpSessionFactory, sessionStore);
        sessionManager = new SessionManager(configManager, sessionStore);

        try {
            if (options.logout) {
                sessionManager.logout(userId);
                out.println("Logged out; stored session removed.");
                return EXIT_OK;
            }

            Credentials credentials = new Credentials(userId, options.cprNumber);
            SessionArtifact session = sessionManager.obtainSession(credentials, options.forceLogin, this::login);
            if (!loggedIn) {
                out.println("Using stored session from " + session.getIssuedAt());
            }
            out.println("Session valid for about " + (sessionManager.getSessionSecondsRemaining(session) / 60) + " more minutes.");

            NordnetClient client = new NordnetClient(httpSessionFactory.newClient(), configManager, session,
                    sessionManager.reauthenticatorFor(credentials, fresh -> {
                        out.println("Session expired, logging in again...");
                        return login(fresh);
                    }));
            printAccounts(client);
            return EXIT_OK;
        } catch (AuthFlowException e) {
            out.println(e.getUserMessage());
            return EXIT_FAILURE;
        } catch (AuthenticationFailedException e) {
            out.println("Nordnet did not accept the login: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (NordnetApiException e) {
            out.println(e.getMessage());
            return EXIT_FAILURE;
        } finally {
            authenticationService.shutdown();
        }
    }

    /**
     * Start a login and render its progress until it finishes.
     */
    SessionArtifact login(Credentials credentials) {
        ProgressChannel channel = new ProgressChannel();
        LoginHandle handle = authenticationService.startLogin(credentials, channel);
        activeLogin = handle;
        loggedIn = true;
        try {
            while (!handle.isDone() || !channel.isEmpty()) {
                ProgressEvent event = channel.poll(200, TimeUnit.MILLISECONDS);
                if (event != null) {
                    render(event);
                }
            }
            return handle.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
            throw AuthFlowException.cancelled();
        } finally {
            activeLogin = null;
        }
    }

    void cancelActiveLogin() {
        LoginHandle handle = activeLogin;
        if (handle != null && !handle.isDone()) {
            LogManager.getInstance().info(LogCategory.AUTHENTICATION, "Cancelling login in progress");
            handle.cancel();
        }
    }

    private void render(ProgressEvent event) {
        switch (event.getType()) {
            case STATE:
                out.println("[" + event.getState() + "] " + event.getMessage());
                break;
            case STATUS:
                out.println("  " + event.getMessage());
                break;
            case INPUT_REQUEST:
                out.print(event.getMessage());
                out.flush();
                try {
                    String line = in.readLine();
                    event.reply(line != null ? line.trim() : null);
                } catch (IOException e) {
                    LogManager.getInstance().error(LogCategory.GENERAL, "Error reading input: " + e.getMessage());
                    event.reply(null);
                }
                break;
            default:
                break;
        }
    }

    private void printAccounts(NordnetClient client) {
        JSONArray accounts = client.getAccounts();
        out.println();
        out.println(String.format("%-12s %-14s %-24s %20s", "Account id", "Number", "Name", "Balance"));
        for (int i = 0; i < accounts.length(); i++) {
            JSONObject account = accounts.getJSONObject(i);
            long accid = account.getLong("accid");
            String name = account.optString("alias", "");
            if (name.isEmpty()) {
                name = account.optString("type", "");
            }
            JSONObject sum = client.getAccountInfo(accid).optJSONObject("account_sum");
            String balance = sum == null ? "-"
                    : String.format("%.2f %s", sum.optDouble("value", 0), sum.optString("currency", ""));
            out.println(String.format("%-12d %-14s %-24s %20s", accid, account.opt("accno"), name, balance));
        }
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: nordnet-portfolio [options]");
        stream.println("  --config <path>   configuration file (default " + ConfigManager.defaultConfigPath() + ")");
        stream.println("  --user <id>       MitID user id");
        stream.println("  --cpr <number>    CPR number, if Nordnet asks to link it");
        stream.println("  --proxy <h:port>  SOCKS5 proxy");
        stream.println("  --force-login     ignore the stored session");
        stream.println("  --logout          remove the stored session and exit");
        stream.println("  --insecure        skip TLS certificate validation");
        stream.println("  --verbose         debug logging");
    }

    /**
     * Parsed command line.
     */
    static final class Options {
        String configPath;
        String userId;
        String cprNumber;
        String proxy;
        boolean forceLogin;
        boolean logout;
        boolean insecure;
        boolean verbose;
        boolean help;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    value = arg.substring(eq + 1);
                    arg = arg.substring(0, eq);
                }
                switch (arg) {
                    case "--config":
                        options.configPath = value != null ? value : next(args, ++i, arg);
                        break;
                    case "--user":
                        options.userId = value != null ? value : next(args, ++i, arg);
                        break;
                    case "--cpr":
                        options.cprNumber = value != null ? value : next(args, ++i, arg);
                        break;
                    case "--proxy":
                        options.proxy = value != null ? value : next(args, ++i, arg);
                        break;
                    case "--force-login":
                        options.forceLogin = true;
                        break;
                    case "--logout":
                        options.logout = true;
                        break;
                    case "--insecure":
                        options.insecure = true;
                        break;
                    case "--verbose":
                    case "-v":
                        options.verbose = true;
                        break;
                    case "--help":
                    case "-h":
                        options.help = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
            return options;
        }

        private static String next(String[] args, int index, String option) {
            if (index >= args.length || args[index].startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        void applyTo(ConfigManager configManager) {
            if (userId != null) {
                configManager.overrideUserId(userId);
            }
            if (proxy != null) {
                configManager.overrideProxy(proxy);
            }
            if (insecure) {
                configManager.overrideIgnoreCertValidation(true);
            }
        }
    }
}
