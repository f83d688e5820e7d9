package com.example.appendagetransfer;

import com.example.appendagetransfer.error.AmbiguousSequenceException;
import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.WalkDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns local files and folder trees into transfer units.
 * <p>
 * Folders are walked depth first: a folder is emitted before its children and siblings
 * follow lexical name order. Sibling files matching the frame pattern with the same prefix
 * and extension collapse into one IMAGE_SEQUENCE unit; a group whose members disagree on
 * padding or extension case is emitted as independent FILE units and reported as an
 * {@link AmbiguousSequenceException}.
 * Directories are listed only when the walk reaches them.
 */
public final class FolderWalker {
    private static final Logger LOGGER = LoggerFactory.getLogger(FolderWalker.class);
    private static final String SEPARATOR = "/";

    private final TransferConfig config;
    private final Pattern framePattern;
    private final Set<String> sequenceExtensions;
    private final List<PathMatcher> excludedFiles;
    private final List<PathMatcher> excludedDirectories;

    public FolderWalker(TransferConfig config) {
        this.config = config;
        this.framePattern = Pattern.compile(config.framePattern());
        this.sequenceExtensions = Set.copyOf(config.sequenceExtensions());
        this.excludedFiles = matchers(config.excludeFilePatterns());
        this.excludedDirectories = matchers(config.excludeDirectoryPatterns());
    }

    /**
     * Walks {@code root}. With a null hint the type follows the path: directories become a
     * folder tree, files a single file. An IMAGE_SEQUENCE hint groups the frames directly
     * inside the root directory into one sequence.
     *
     * @throws LocalIoException if the root is missing, unreadable or does not fit the hint
     */
    public UnitSource walk(Path root, AppendageType hint) throws LocalIoException {
        Path normalized = root.toAbsolutePath().normalize();
        if (!Files.exists(normalized, linkOptions())) {
            throw new LocalIoException(normalized, "Path does not exist");
        }
        if (!Files.isReadable(normalized)) {
            throw new LocalIoException(normalized, "Path is not readable");
        }
        boolean directory = Files.isDirectory(normalized, linkOptions());
        AppendageType type = hint != null ? hint : directory ? AppendageType.FOLDER : AppendageType.FILE;
        switch (type) {
            case FILE:
                return singleFile(normalized);
            case FOLDER:
                if (!directory) {
                    throw new LocalIoException(normalized, "Not a directory");
                }
                return new TreeWalk(normalized);
            case IMAGE_SEQUENCE:
                if (!directory) {
                    throw new LocalIoException(normalized, "Image sequence root is not a directory");
                }
                return imageSequence(listFrameFiles(normalized));
            default:
                throw new IllegalArgumentException("Unsupported type hint " + hint);
        }
    }

    public UnitSource singleFile(Path file) throws LocalIoException {
        Path normalized = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized) || !Files.isReadable(normalized)) {
            throw new LocalIoException(normalized, "File missing or unreadable");
        }
        String name = normalized.getFileName().toString();
        TransferUnit unit = new TransferUnit(0, TransferUnit.NO_PARENT, name, name, AppendageType.FILE,
                normalized, TransferUnit.NO_REMOTE_ID, safeSize(normalized), List.of());
        return UnitSource.of(List.of(unit), List.of());
    }

    /**
     * Builds one IMAGE_SEQUENCE unit from explicit frame files, which must share a folder.
     * Inconsistent frames degrade to independent FILE units.
     */
    public UnitSource imageSequence(List<Path> frames) throws LocalIoException {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("An image sequence needs at least one frame");
        }
        List<Path> sorted = new ArrayList<>();
        for (Path frame : frames) {
            Path normalized = frame.toAbsolutePath().normalize();
            if (!Files.isRegularFile(normalized) || !Files.isReadable(normalized)) {
                throw new LocalIoException(normalized, "Frame missing or unreadable");
            }
            sorted.add(normalized);
        }
        sorted.sort(Comparator.comparing(path -> path.getFileName().toString()));
        Path folder = sorted.get(0).getParent();
        for (Path frame : sorted) {
            if (!frame.getParent().equals(folder)) {
                throw new IllegalArgumentException("All frames of an image sequence must be in one folder: " + frame);
            }
        }

        List<String> names = sorted.stream().map(path -> path.getFileName().toString()).toList();
        String problem = sequenceProblem(names);
        String sequenceName = sequenceName(names.get(0));
        if (problem == null) {
            TransferUnit unit = new TransferUnit(0, TransferUnit.NO_PARENT, sequenceName, sequenceName,
                    AppendageType.IMAGE_SEQUENCE, folder, TransferUnit.NO_REMOTE_ID, totalSize(sorted), names);
            return UnitSource.of(List.of(unit), List.of());
        }
        WalkDiagnostic diagnostic = ambiguous(sequenceName, sequenceName, names, problem);
        List<TransferUnit> units = new ArrayList<>();
        for (Path frame : sorted) {
            String name = frame.getFileName().toString();
            units.add(new TransferUnit(units.size(), TransferUnit.NO_PARENT, name, name, AppendageType.FILE,
                    frame, TransferUnit.NO_REMOTE_ID, safeSize(frame), List.of()));
        }
        return UnitSource.of(units, List.of(diagnostic));
    }

    private List<Path> listFrameFiles(Path folder) throws LocalIoException {
        List<Path> frames = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                if (Files.isRegularFile(entry, linkOptions()) && !isExcluded(entry, excludedFiles)
                        && frameMatch(name) != null) {
                    frames.add(entry);
                }
            }
        } catch (IOException ex) {
            throw new LocalIoException(folder, ex);
        }
        if (frames.isEmpty()) {
            throw new LocalIoException(folder, "No frame files found");
        }
        return frames;
    }

    private final class TreeWalk implements UnitSource {
        private final Path root;
        private final Deque<Level> stack = new ArrayDeque<>();
        private final List<WalkDiagnostic> diagnostics = new ArrayList<>();
        private TransferUnit lookahead;
        private boolean rootEmitted;
        private int nextIndex;

        private TreeWalk(Path root) {
            this.root = root;
        }

        @Override
        public List<WalkDiagnostic> diagnostics() {
            return List.copyOf(diagnostics);
        }

        @Override
        public boolean hasNext() {
            if (lookahead == null) {
                lookahead = advance();
            }
            return lookahead != null;
        }

        @Override
        public TransferUnit next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TransferUnit unit = lookahead;
            lookahead = null;
            return unit;
        }

        private TransferUnit advance() {
            if (!rootEmitted) {
                rootEmitted = true;
                String name = root.getFileName() == null ? root.toString() : root.getFileName().toString();
                TransferUnit unit = new TransferUnit(nextIndex++, TransferUnit.NO_PARENT, name, name,
                        AppendageType.FOLDER, root, TransferUnit.NO_REMOTE_ID, 0L, List.of());
                stack.push(new Level(unit));
                return unit;
            }
            while (!stack.isEmpty()) {
                Level level = stack.peek();
                if (level.entries == null) {
                    level.entries = listEntries(level.folder).iterator();
                }
                if (!level.entries.hasNext()) {
                    stack.pop();
                    continue;
                }
                Entry entry = level.entries.next();
                String relativePath = level.folder.relativePath() + SEPARATOR + entry.name;
                TransferUnit unit = new TransferUnit(nextIndex++, level.folder.index(), relativePath, entry.name,
                        entry.type, entry.path, TransferUnit.NO_REMOTE_ID, entry.size, entry.members);
                if (entry.type == AppendageType.FOLDER) {
                    stack.push(new Level(unit));
                }
                return unit;
            }
            return null;
        }

        private List<Entry> listEntries(TransferUnit folder) {
            List<Path> directories = new ArrayList<>();
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder.localPath())) {
                for (Path child : stream) {
                    if (!config.followLinks() && Files.isSymbolicLink(child)) {
                        continue;
                    }
                    if (Files.isDirectory(child, linkOptions())) {
                        if (!isExcluded(child, excludedDirectories)) {
                            directories.add(child);
                        }
                    } else if (Files.isRegularFile(child, linkOptions())) {
                        if (!isExcluded(child, excludedFiles)) {
                            files.add(child);
                        }
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", folder.localPath(), ex);
                diagnostics.add(new WalkDiagnostic(folder.relativePath(), LocalIoException.class.getSimpleName(),
                        "Directory could not be listed: " + ex.getMessage(), true));
                return List.of();
            }

            List<Entry> entries = new ArrayList<>();
            for (Path directory : directories) {
                entries.add(new Entry(directory.getFileName().toString(), AppendageType.FOLDER, directory, 0L,
                        List.of()));
            }
            entries.addAll(groupFiles(folder.relativePath(), files, diagnostics));
            entries.sort(Comparator.comparing(entry -> entry.sortKey));
            return entries;
        }
    }

    /**
     * Splits sibling files into frame groups and plain files. Frames belong to the same group
     * when they share prefix and extension, so an EXR and a JPEG render of one shot become two
     * sequences. Differing case of the extension stays in one group and is reported as
     * inconsistent, as is differing padding.
     */
    private List<Entry> groupFiles(String folderPath, List<Path> files, List<WalkDiagnostic> diagnostics) {
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        List<Entry> entries = new ArrayList<>();
        Map<FrameKey, List<Path>> groups = new LinkedHashMap<>();
        for (Path file : files) {
            Matcher match = frameMatch(file.getFileName().toString());
            if (match == null) {
                entries.add(fileEntry(file));
            } else {
                FrameKey key = new FrameKey(match.group(1), match.group(3).toLowerCase(Locale.ROOT));
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(file);
            }
        }
        Map<String, Long> groupsPerPrefix = groups.keySet().stream()
                .collect(Collectors.groupingBy(FrameKey::prefix, Collectors.counting()));

        for (Map.Entry<FrameKey, List<Path>> group : groups.entrySet()) {
            List<Path> run = group.getValue();
            if (run.size() < config.minSequenceLength()) {
                run.forEach(path -> entries.add(fileEntry(path)));
                continue;
            }
            List<String> names = run.stream().map(path -> path.getFileName().toString()).toList();
            String name = sequenceName(names.get(0));
            if (groupsPerPrefix.get(group.getKey().prefix()) > 1) {
                name = name + "_" + group.getKey().extension().replaceFirst("^\\.", "");
            }
            String problem = sequenceProblem(names);
            if (problem == null) {
                entries.add(new Entry(name, AppendageType.IMAGE_SEQUENCE, run.get(0).getParent(), totalSize(run),
                        names, names.get(0)));
            } else {
                diagnostics.add(ambiguous(folderPath + SEPARATOR + name, name, names, problem));
                run.forEach(path -> entries.add(fileEntry(path)));
            }
        }
        return entries;
    }

    /**
     * Returns why the frames cannot form one sequence, or null if they can.
     */
    private String sequenceProblem(List<String> names) {
        Integer width = null;
        String extension = null;
        for (String name : names) {
            Matcher match = frameMatch(name);
            if (match == null) {
                return "'" + name + "' does not match the frame pattern";
            }
            if (width == null) {
                width = match.group(2).length();
                extension = match.group(3);
            } else if (match.group(2).length() != width) {
                return "inconsistent frame padding ('" + name + "' has " + match.group(2).length()
                        + " digits, expected " + width + ")";
            } else if (!match.group(3).equals(extension)) {
                return "inconsistent extension ('" + name + "' is not " + extension + ")";
            }
        }
        return null;
    }

    private WalkDiagnostic ambiguous(String relativePath, String name, List<String> members, String problem) {
        AmbiguousSequenceException finding = new AmbiguousSequenceException(name, members, problem);
        LOGGER.warn("{}; transferring its files individually.", finding.getMessage());
        return new WalkDiagnostic(relativePath, AmbiguousSequenceException.class.getSimpleName(),
                finding.getMessage(), false);
    }

    private Matcher frameMatch(String fileName) {
        Matcher matcher = framePattern.matcher(fileName);
        if (!matcher.matches()) {
            return null;
        }
        String extension = matcher.group(3).replaceFirst("^\\.", "").toLowerCase(Locale.ROOT);
        return sequenceExtensions.contains(extension) ? matcher : null;
    }

    /**
     * Display name of a sequence: the frame prefix without trailing separators.
     */
    private String sequenceName(String firstFrame) {
        Matcher match = frameMatch(firstFrame);
        String prefix = match == null ? firstFrame.replaceFirst("\\.[^.]*$", "") : match.group(1);
        String trimmed = prefix.replaceFirst("[ ._\\-]+$", "");
        return trimmed.isEmpty() ? "sequence" : trimmed;
    }

    private Entry fileEntry(Path file) {
        return new Entry(file.getFileName().toString(), AppendageType.FILE, file, safeSize(file), List.of());
    }

    private long totalSize(List<Path> files) {
        return files.stream().mapToLong(this::safeSize).sum();
    }

    private long safeSize(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read size for {}", file, ex);
            return 0L;
        }
    }

    private boolean isExcluded(Path path, List<PathMatcher> matchers) {
        Path name = path.getFileName();
        return name != null && matchers.stream().anyMatch(matcher -> matcher.matches(name));
    }

    private LinkOption[] linkOptions() {
        return config.followLinks() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    private static List<PathMatcher> matchers(List<String> globs) {
        return globs.stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
    }

    private record FrameKey(String prefix, String extension) {
    }

    private static final class Level {
        private final TransferUnit folder;
        private Iterator<Entry> entries;

        private Level(TransferUnit folder) {
            this.folder = folder;
        }
    }

    private static final class Entry {
        private final String name;
        private final AppendageType type;
        private final Path path;
        private final long size;
        private final List<String> members;
        private final String sortKey;

        private Entry(String name, AppendageType type, Path path, long size, List<String> members) {
            this(name, type, path, size, members, name);
        }

        private Entry(String name, AppendageType type, Path path, long size, List<String> members, String sortKey) {
            this.name = name;
            this.type = type;
            this.path = path;
            this.size = size;
            this.members = members;
            this.sortKey = sortKey;
        }
    }
}
