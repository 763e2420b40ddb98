package com.geotokens.save;

import com.geotokens.core.GameWorld;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores named sessions on disk.
 *
 * Save structure:
 *   &lt;root&gt;/&lt;session-name&gt;/
 *     session.dat   snapshot blob (see {@link SnapshotCodec})
 *
 * The default root is ~/.geotokens/saves.
 */
public class SaveManager {

    private static final Logger LOG = Logger.getLogger(SaveManager.class.getName());

    public static final String SESSION_FILE = "session.dat";

    private static final Pattern SESSION_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path savesRoot;
    private final String sessionName;
    private final Path sessionDir;

    public SaveManager(String sessionName) {
        this(getDefaultSavesRoot(), sessionName);
    }

    /** @throws IllegalArgumentException if the name is not a plain session name */
    public SaveManager(Path savesRoot, String sessionName) {
        requireValidName(sessionName);
        this.savesRoot = savesRoot;
        this.sessionName = sessionName;
        this.sessionDir = savesRoot.resolve(sessionName);
    }

    /** Letters, digits, '-' and '_' only, so a name never escapes the saves root. */
    public static boolean isValidSessionName(String name) {
        return name != null && SESSION_NAME.matcher(name).matches();
    }

    private static void requireValidName(String name) {
        if (!isValidSessionName(name)) {
            throw new IllegalArgumentException("Invalid session name: " + name);
        }
    }

    public static Path getDefaultSavesRoot() {
        String home = System.getProperty("user.home");
        return Paths.get(home, ".geotokens", "saves");
    }

    public String getSessionName() { return sessionName; }

    public boolean exists() {
        return Files.isRegularFile(sessionDir.resolve(SESSION_FILE));
    }

    /** Write the world's current state. */
    public void save(GameWorld world) throws IOException {
        Files.createDirectories(sessionDir);
        Path file = sessionDir.resolve(SESSION_FILE);
        Path tmp = sessionDir.resolve(SESSION_FILE + ".tmp");
        Files.writeString(tmp, world.exportBlob(), StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Saved session '" + sessionName + "' (" + world.getLedger().size() + " ledger entries)");
    }

    /**
     * Restore the world from disk. A missing or unreadable session leaves the
     * world at a fresh start.
     *
     * @return true if a saved session was applied
     */
    public boolean load(GameWorld world) {
        Path file = sessionDir.resolve(SESSION_FILE);
        if (!Files.isRegularFile(file)) {
            LOG.info("No saved session '" + sessionName + "', starting fresh");
            world.reset();
            return false;
        }
        String blob;
        try {
            blob = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read session " + file, e);
            world.reset();
            return false;
        }
        return world.importBlob(blob);
    }

    // ---- Session management ----

    /** Names of all sessions under the saves root that contain a session file. */
    public List<String> listSessions() {
        List<String> result = new ArrayList<>();
        if (!Files.isDirectory(savesRoot)) return result;
        try (Stream<Path> dirs = Files.list(savesRoot)) {
            dirs.filter(d -> Files.isRegularFile(d.resolve(SESSION_FILE)))
                .map(d -> d.getFileName().toString())
                .sorted()
                .forEach(result::add);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to list sessions in " + savesRoot, e);
        }
        return result;
    }

    /**
     * Recursively remove another session's directory.
     *
     * @return false if there was no such session
     * @throws IllegalArgumentException for an invalid name or the active session
     */
    public boolean deleteSession(String name) throws IOException {
        requireValidName(name);
        if (name.equals(sessionName)) {
            throw new IllegalArgumentException("Cannot delete the active session '" + name + "'");
        }
        Path dir = savesRoot.resolve(name);
        if (!Files.exists(dir)) return false;
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
        LOG.info("Deleted session '" + name + "'");
        return true;
    }
}
