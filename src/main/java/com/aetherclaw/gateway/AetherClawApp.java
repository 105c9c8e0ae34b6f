package com.aetherclaw.gateway;

import com.aetherclaw.auth.CredentialStore;
import com.aetherclaw.auth.CredentialVerifier;
import com.aetherclaw.auth.PairingFlow;
import com.aetherclaw.auth.TelegramSetupWizard;
import com.aetherclaw.channels.telegram.TelegramBotClient;
import com.aetherclaw.observability.DoctorCommand;
import com.aetherclaw.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class AetherClawApp {

    private static final Logger log = LoggerFactory.getLogger(AetherClawApp.class);

    public static void main(String[] args) {
        var command = args.length > 0 ? args[0] : "setup-telegram";
        var config = ConfigLoader.load();
        log.debug("Using env file {} and Telegram API {}", config.envFile(), config.telegram().apiBaseUrl());

        var apiFactory = TelegramBotClient.factory(config.telegram());
        var store = new CredentialStore(config.envFile());
        var verifier = new CredentialVerifier(apiFactory);

        switch (command) {
            case "setup-telegram" -> {
                var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                var flow = new PairingFlow(apiFactory, store, config.telegram().pairing());
                var paired = new TelegramSetupWizard(reader, System.out, verifier, flow, store).run();
                System.exit(paired ? 0 : 1);
            }
            case "doctor" -> System.out.println(new DoctorCommand(store, verifier).run());
            default -> {
                System.err.println("Unknown command: " + command);
                System.err.println("Usage: aetherclaw [setup-telegram|doctor]");
                System.exit(2);
            }
        }
    }
}
