package com.aetherclaw.auth;

import com.aetherclaw.shared.config.RuntimeEnv;
import com.aetherclaw.shared.model.ChannelBinding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CredentialStoreTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        RuntimeEnv.clear();
    }

    private static void assumePosix() {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    }

    @Test
    void replacesInPlaceAndAppendsMissingKey() throws IOException {
        var env = tempDir.resolve(".env");
        Files.writeString(env, "A=1\nTELEGRAM_BOT_TOKEN=old\nB=2\n");

        new CredentialStore(env).save(new ChannelBinding("new", "555"));

        assertEquals(List.of("A=1", "TELEGRAM_BOT_TOKEN=new", "B=2", "TELEGRAM_CHAT_ID=555"),
                Files.readAllLines(env));
    }

    @Test
    void savingTwiceEqualsSavingOnce() throws IOException {
        var env = tempDir.resolve(".env");
        Files.writeString(env, "# settings\nA=1\nTELEGRAM_BOT_TOKEN=old\nB=2");
        var store = new CredentialStore(env);
        var binding = new ChannelBinding("new", "555");

        store.save(binding);
        var once = Files.readString(env);
        store.save(binding);

        assertEquals(once, Files.readString(env));
        assertEquals("# settings\nA=1\nTELEGRAM_BOT_TOKEN=new\nB=2\nTELEGRAM_CHAT_ID=555\n", once);
    }

    @Test
    void createsFileAndParentDirectories() throws IOException {
        var env = tempDir.resolve("conf").resolve(".env");

        new CredentialStore(env).save(new ChannelBinding("T1", "777"));

        assertEquals("TELEGRAM_BOT_TOKEN=T1\nTELEGRAM_CHAT_ID=777\n", Files.readString(env));
        assertFalse(Files.exists(tempDir.resolve("conf").resolve(".env.tmp")));
    }

    @Test
    void unrelatedBytesAreUntouched() throws IOException {
        var env = tempDir.resolve(".env");
        var original = "GREETING=héllo ✓\r\nTELEGRAM_CHAT_ID=1\r\n\r\n  TELEGRAM_BOT_TOKEN_OLD=x\r\n";
        Files.write(env, original.getBytes(StandardCharsets.UTF_8));

        new CredentialStore(env).save(new ChannelBinding("T1", "777"));

        var expected = "GREETING=héllo ✓\r\nTELEGRAM_CHAT_ID=777\r\n\r\n  TELEGRAM_BOT_TOKEN_OLD=x\r\n"
                + "TELEGRAM_BOT_TOKEN=T1\n";
        assertArrayEquals(expected.getBytes(StandardCharsets.UTF_8), Files.readAllBytes(env));
    }

    @Test
    void keyMustMatchAtLineStart() {
        var merged = CredentialStore.merge("# TELEGRAM_CHAT_ID=9\nXTELEGRAM_CHAT_ID=8\n",
                java.util.Map.of(CredentialStore.CHAT_ID_KEY, "777"));

        assertEquals("# TELEGRAM_CHAT_ID=9\nXTELEGRAM_CHAT_ID=8\nTELEGRAM_CHAT_ID=777\n", merged);
    }

    @Test
    void saveMirrorsValuesIntoRuntimeEnvironment() throws IOException {
        new CredentialStore(tempDir.resolve(".env")).save(new ChannelBinding("T-env", "4242"));

        assertEquals("T-env", RuntimeEnv.get(CredentialStore.TOKEN_KEY));
        assertEquals("4242", RuntimeEnv.get(CredentialStore.CHAT_ID_KEY));
    }

    @Test
    void loadReadsCompleteBindingOnly() throws IOException {
        var env = tempDir.resolve(".env");
        var store = new CredentialStore(env);
        assertTrue(store.load().isEmpty());

        Files.writeString(env, "TELEGRAM_BOT_TOKEN=T1\nTELEGRAM_CHAT_ID=\n");
        assertTrue(store.load().isEmpty());

        Files.writeString(env, "TELEGRAM_BOT_TOKEN=T1\nTELEGRAM_CHAT_ID=777\n");
        assertEquals(new ChannelBinding("T1", "777"), store.load().orElseThrow());
    }

    @Test
    void detectsEarlierTelegramSetup() throws IOException {
        var env = tempDir.resolve(".env");
        var store = new CredentialStore(env);
        assertFalse(store.hasTelegramEntries());

        Files.writeString(env, "A=1\n");
        assertFalse(store.hasTelegramEntries());

        Files.writeString(env, "A=1\n  TELEGRAM_CHAT_ID =\n");
        assertTrue(store.hasTelegramEntries());
    }

    @Test
    void unwritableTargetFailsWithIOException() {
        assertThrows(IOException.class, () -> new CredentialStore(tempDir).save(new ChannelBinding("T1", "777")));
    }

    @Test
    void ownerOnlyFileStaysOwnerOnly() throws IOException {
        assumePosix();
        var env = tempDir.resolve(".env");
        Files.writeString(env, "A=1\n");
        Files.setPosixFilePermissions(env, PosixFilePermissions.fromString("rw-------"));

        new CredentialStore(env).save(new ChannelBinding("SECRET", "777"));

        assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(env)));
    }

    @Test
    void existingModeIsKeptOnSave() throws IOException {
        assumePosix();
        var env = tempDir.resolve(".env");
        Files.writeString(env, "A=1\n");
        Files.setPosixFilePermissions(env, PosixFilePermissions.fromString("rw-r-----"));

        new CredentialStore(env).save(new ChannelBinding("SECRET", "777"));

        assertEquals("rw-r-----", PosixFilePermissions.toString(Files.getPosixFilePermissions(env)));
    }

    @Test
    void newFileIsOwnerOnly() throws IOException {
        assumePosix();
        var env = tempDir.resolve(".env");

        new CredentialStore(env).save(new ChannelBinding("SECRET", "777"));

        assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(env)));
    }

    @Test
    void failedSaveLeavesNoTempFileBehind() throws IOException {
        var target = tempDir.resolve("occupied");
        Files.createDirectories(target);
        Files.writeString(target.resolve("child"), "x");

        assertThrows(IOException.class, () -> new CredentialStore(target).save(new ChannelBinding("SECRET", "777")));
        assertFalse(Files.exists(tempDir.resolve("occupied.tmp")));
    }
}
