package com.aetherclaw.auth;

import com.aetherclaw.channels.telegram.BotApiFactory;
import com.aetherclaw.shared.model.BotCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/** Checks a bot token with one getMe call. Retrying is left to the caller. */
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);
    private static final String UNKNOWN = "unknown";
    // no valid bot token contains whitespace or control characters
    private static final Pattern MALFORMED = Pattern.compile("[\\s\\p{Cntrl}]");

    private final BotApiFactory apiFactory;

    public CredentialVerifier(BotApiFactory apiFactory) {
        this.apiFactory = apiFactory;
    }

    public VerificationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return VerificationResult.failed("Token cannot be empty");
        }
        var candidate = token.trim();
        if (MALFORMED.matcher(candidate).find()) {
            return VerificationResult.failed("Invalid token format");
        }
        var result = apiFactory.open(candidate).getMe();
        if (!result.isOk()) {
            log.info("Bot token {} rejected: {}", Secrets.mask(candidate), result.error());
            return VerificationResult.failed(result.error());
        }

        var bot = result.value();
        var handle = bot.getUserName() != null ? bot.getUserName() : UNKNOWN;
        var name = bot.getFirstName() != null ? bot.getFirstName() : UNKNOWN;
        log.info("Bot token verified for {} (@{})", name, handle);
        return VerificationResult.verified(new BotCredential(candidate, handle, name));
    }
}
