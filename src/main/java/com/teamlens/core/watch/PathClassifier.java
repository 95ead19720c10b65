package com.teamlens.core.watch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a raw filesystem path to a {@link FileChange}.
 * <p>
 * Recognised layouts, relative to the two watched roots:
 * <pre>
 *   teams/&lt;team&gt;/config.json             team config
 *   teams/&lt;team&gt;/inboxes/&lt;agent&gt;.json     agent inbox
 *   tasks/&lt;team&gt;/&lt;id&gt;.json                task
 * </pre>
 * Separators are normalised to {@code /} before matching. Every input maps to exactly one
 * result and the classifier never throws; anything unrecognised is {@link ChangeKind#IGNORED}.
 */
public class PathClassifier {

    private static final String JSON_SUFFIX = ".json";

    private final String teamsPrefix;
    private final String tasksPrefix;
    private final String configFileName;
    private final String inboxDirName;

    public PathClassifier(Path teamsRoot, Path tasksRoot, String configFileName, String inboxDirName) {
        this.teamsPrefix = normalize(teamsRoot.toAbsolutePath().normalize().toString());
        this.tasksPrefix = normalize(tasksRoot.toAbsolutePath().normalize().toString());
        this.configFileName = configFileName;
        this.inboxDirName = inboxDirName;
    }

    public PathClassifier(Path teamsRoot, Path tasksRoot) {
        this(teamsRoot, tasksRoot, "config.json", "inboxes");
    }

    public FileChange classify(Path path) {
        if (path == null) {
            return FileChange.ignored(null);
        }
        return classify(path.toString(), path);
    }

    /**
     * Classifies a path given as a string, as reported by a watch primitive on any platform.
     */
    public FileChange classify(String rawPath) {
        if (rawPath == null) {
            return FileChange.ignored(null);
        }
        Path path;
        try {
            path = Path.of(rawPath);
        } catch (RuntimeException e) {
            path = null;
        }
        return classify(rawPath, path);
    }

    private FileChange classify(String rawPath, Path original) {
        String normalized = normalize(rawPath);
        if (!normalized.toLowerCase(Locale.ROOT).endsWith(JSON_SUFFIX)) {
            return FileChange.ignored(original);
        }

        // Tasks first: the tasks root may be nested under the teams root.
        List<String> taskSegments = segmentsUnder(tasksPrefix, normalized);
        if (taskSegments != null) {
            if (taskSegments.size() == 2) {
                String taskId = stripJson(taskSegments.get(1));
                if (!taskId.isEmpty()) {
                    return FileChange.task(original, taskSegments.get(0), taskId);
                }
            }
            return FileChange.ignored(original);
        }

        List<String> teamSegments = segmentsUnder(teamsPrefix, normalized);
        if (teamSegments == null) {
            return FileChange.ignored(original);
        }
        if (teamSegments.size() == 3 && teamSegments.get(1).equals(inboxDirName)) {
            String agentName = stripJson(teamSegments.get(2));
            if (!agentName.isEmpty()) {
                return FileChange.inbox(original, teamSegments.get(0), agentName);
            }
        }
        if (teamSegments.size() == 2 && teamSegments.get(1).equals(configFileName)) {
            return FileChange.teamConfig(original, teamSegments.get(0));
        }
        return FileChange.ignored(original);
    }

    /** Returns the path segments below {@code prefix}, or {@code null} when outside it. */
    private static List<String> segmentsUnder(String prefix, String normalized) {
        if (!normalized.startsWith(prefix + "/")) {
            return null;
        }
        var segments = new ArrayList<String>();
        for (String segment : normalized.substring(prefix.length() + 1).split("/")) {
            if (!segment.isEmpty() && !segment.equals(".")) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static String stripJson(String fileName) {
        return fileName.substring(0, fileName.length() - JSON_SUFFIX.length());
    }

    static String normalize(String raw) {
        String s = raw.replace('\\', '/');
        while (s.contains("//")) {
            s = s.replace("//", "/");
        }
        if (s.length() > 1 && s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
