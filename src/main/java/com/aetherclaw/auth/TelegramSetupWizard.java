package com.aetherclaw.auth;

import com.aetherclaw.shared.model.BotCredential;
import com.aetherclaw.shared.model.ChannelBinding;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Console front end of {@link PairingFlow}: asks for the bot token until it verifies (or
 * the operator gives up), then reports each pairing step as it happens.
 */
public class TelegramSetupWizard {

    private final BufferedReader reader;
    private final PrintStream out;
    private final CredentialVerifier verifier;
    private final PairingFlow flow;
    private final CredentialStore store;
    private boolean inputClosed;

    public TelegramSetupWizard(BufferedReader reader, PrintStream out, CredentialVerifier verifier,
                               PairingFlow flow, CredentialStore store) {
        this.reader = reader;
        this.out = out;
        this.verifier = verifier;
        this.flow = flow;
        this.store = store;
    }

    /** Returns true only when a chat was paired and saved. */
    public boolean run() {
        out.println();
        out.println("Telegram Bot Setup");
        out.println("-".repeat(50));
        var prompt = store.hasTelegramEntries()
                ? "Connect a new Telegram bot? [y/N]: "
                : "Set up Telegram bot? [y/N]: ";
        if (!"y".equalsIgnoreCase(ask(prompt, "n"))) {
            out.println("Telegram setup skipped");
            return false;
        }

        printBotFatherSteps();
        var credential = askForToken();
        if (credential == null) return false;

        out.println();
        out.println("Step 2: Pair your bot");
        out.printf("  1. Open Telegram and search for @%s%n", credential.handle());
        out.println("  2. Click Start or send /start to your bot");
        out.println("Waiting for /start...");

        var outcome = flow.pair(credential, new ConsoleProgress());
        report(outcome);
        return outcome.isPaired();
    }

    private BotCredential askForToken() {
        while (true) {
            var token = ask("Enter your bot token: ", "");
            if (token.isEmpty()) {
                if (inputClosed) return null;
                out.println("[WARN] Token cannot be empty");
                continue;
            }
            out.println("Verifying token...");
            var result = verifier.verify(token);
            if (result.isVerified()) {
                var bot = result.credential();
                out.printf("[OK] Bot verified: %s (@%s)%n", bot.displayName(), bot.handle());
                return bot;
            }
            out.println("[FAIL] Invalid token. Please check and try again.");
            if ("n".equalsIgnoreCase(ask("Try again? [Y/n]: ", "y"))) return null;
        }
    }

    private void report(PairingOutcome outcome) {
        switch (outcome.status()) {
            case PAIRED:
                out.printf("[OK] Credentials saved to %s%n", store.envFile());
                out.printf("[OK] Bot: @%s%n", outcome.credential().handle());
                out.printf("[OK] Chat ID: %s%n", outcome.binding().conversationId());
                break;
            case HANDSHAKE_TIMEOUT:
                out.println("[FAIL] Timeout: did not receive /start command");
                out.println("Make sure you sent /start to your bot");
                break;
            case CHALLENGE_TIMEOUT:
                out.println("[FAIL] Pairing failed: code not received or timeout");
                break;
            case PERSIST_FAILED:
                out.println("[FAIL] " + outcome.detail());
                break;
            default:
                out.println("[FAIL] Pairing aborted: " + outcome.detail());
        }
    }

    private void printBotFatherSteps() {
        out.println();
        out.println("Step 1: Create a bot with BotFather");
        out.println("  1. Open Telegram and search for @BotFather");
        out.println("  2. Send /newbot to BotFather");
        out.println("  3. Choose a name and a username ending in 'bot'");
        out.println("  4. BotFather replies with a token like 123456:ABC-DEF1234ghIkl-zyx57W2v1u123ew11");
        out.println();
    }

    private String ask(String prompt, String fallback) {
        out.print(prompt);
        out.flush();
        try {
            var line = reader.readLine();
            if (line == null) {
                inputClosed = true;
                return fallback;
            }
            if (line.isBlank()) return fallback;
            return line.trim();
        } catch (IOException e) {
            inputClosed = true;
            return fallback;
        }
    }

    private class ConsoleProgress implements PairingListener {

        @Override
        public void onStarted(String conversationId, String senderName) {
            out.printf("[OK] Received /start from %s%n", senderName);
        }

        @Override
        public void onCodeIssued(Challenge challenge) {
            if (challenge.delivered()) {
                out.println("[OK] Sent pairing code to bot");
            } else {
                out.println("[WARN] Could not send message (you can still enter the code manually)");
            }
            out.printf("Pairing code: %s%n", challenge.code());
            out.println("Waiting for pairing code... (send this code to your bot in Telegram)");
        }

        @Override
        public void onPaired(ChannelBinding binding) {
            out.println("[OK] Pairing code verified!");
        }
    }
}
