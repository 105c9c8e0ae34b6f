package com.aetherclaw.observability;

import com.aetherclaw.auth.CredentialStore;
import com.aetherclaw.auth.CredentialVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public class DoctorCommand {

    private static final Logger log = LoggerFactory.getLogger(DoctorCommand.class);

    private final CredentialStore store;
    private final CredentialVerifier verifier;

    public DoctorCommand(CredentialStore store, CredentialVerifier verifier) {
        this.store = store;
        this.verifier = verifier;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkEnvFile());
        results.addAll(checkTelegram());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkEnvFile() {
        return Files.isRegularFile(store.envFile())
                ? "[OK] Env file " + store.envFile()
                : "[WARN] Env file not found: " + store.envFile() + " (created by setup-telegram)";
    }

    private List<String> checkTelegram() {
        var lines = new ArrayList<String>();
        try {
            var binding = store.load();
            if (binding.isEmpty()) {
                lines.add("[OK] Telegram: not configured (optional)");
                return lines;
            }
            lines.add("[OK] Telegram: paired with chat " + binding.get().conversationId());
            var result = verifier.verify(binding.get().token());
            lines.add(result.isVerified()
                    ? "[OK] Telegram bot @" + result.credential().handle() + " reachable"
                    : "[FAIL] Telegram bot token: " + result.failure());
        } catch (Exception e) {
            log.debug("Telegram check failed", e);
            lines.add("[FAIL] Telegram: " + e.getMessage());
        }
        return lines;
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
