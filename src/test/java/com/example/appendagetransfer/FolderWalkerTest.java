package com.example.appendagetransfer;

import com.example.appendagetransfer.error.AmbiguousSequenceException;
import com.example.appendagetransfer.error.LocalIoException;
import com.example.appendagetransfer.model.AppendageType;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.WalkDiagnostic;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FolderWalkerTest {
    private final FolderWalker walker = new FolderWalker(TransferConfig.defaults());

    @Test
    void emitsFoldersBeforeChildrenInLexicalOrder() throws Exception {
        Path root = Files.createTempDirectory("walker").resolve("A");
        Files.createDirectories(root.resolve("B"));
        Files.writeString(root.resolve("B/file1.jpg"), "one");
        Files.writeString(root.resolve("file2.png"), "two");
        Files.writeString(root.resolve("C.txt"), "three");

        List<TransferUnit> units = walker.walk(root, null).stream().toList();

        assertEquals(List.of("A", "A/B", "A/B/file1.jpg", "A/C.txt", "A/file2.png"),
                units.stream().map(TransferUnit::relativePath).toList());
        assertEquals(AppendageType.FOLDER, units.get(0).type());
        assertTrue(units.get(0).isRoot());
        assertEquals(0, units.get(1).parentIndex());
        assertEquals(1, units.get(2).parentIndex());
        assertEquals(0, units.get(4).parentIndex());
        assertEquals(3L, units.get(2).size());
        for (TransferUnit unit : units) {
            assertTrue(unit.parentIndex() < unit.index(), unit.relativePath());
        }
    }

    @Test
    void groupsNumberedFramesIntoOneSequence() throws Exception {
        Path root = Files.createTempDirectory("walker-seq");
        for (int frame = 1; frame <= 10; frame++) {
            Files.writeString(root.resolve(String.format("frame_%04d.png", frame)), "px");
        }
        Files.writeString(root.resolve("notes.txt"), "n");

        UnitSource source = walker.walk(root, AppendageType.FOLDER);
        List<TransferUnit> units = source.stream().toList();

        List<TransferUnit> sequences = units.stream()
                .filter(unit -> unit.type() == AppendageType.IMAGE_SEQUENCE)
                .toList();
        assertEquals(1, sequences.size());
        TransferUnit sequence = sequences.get(0);
        assertEquals("frame", sequence.name());
        assertEquals(10, sequence.members().size());
        assertEquals("frame_0001.png", sequence.members().get(0));
        assertEquals(root.toAbsolutePath().normalize(), sequence.localPath());
        assertEquals(20L, sequence.size());
        assertEquals(3, units.size());
        assertTrue(source.diagnostics().isEmpty());
    }

    @Test
    void inconsistentPaddingDegradesToFiles() throws Exception {
        Path root = Files.createTempDirectory("walker-ambiguous");
        for (int frame = 1; frame <= 10; frame++) {
            String name = frame == 5 ? "frame_005.png" : String.format("frame_%04d.png", frame);
            Files.writeString(root.resolve(name), "px");
        }

        UnitSource source = walker.walk(root, AppendageType.FOLDER);
        List<TransferUnit> units = source.stream().toList();

        List<TransferUnit> files = units.stream().filter(unit -> unit.type() == AppendageType.FILE).toList();
        assertEquals(10, files.size());
        assertTrue(units.stream().noneMatch(unit -> unit.type() == AppendageType.IMAGE_SEQUENCE));
        assertEquals(1, source.diagnostics().size());
        WalkDiagnostic diagnostic = source.diagnostics().get(0);
        assertEquals(AmbiguousSequenceException.class.getSimpleName(), diagnostic.errorType());
        assertFalse(diagnostic.error());
    }

    @Test
    void parallelRendersInDifferentFormatsBecomeSeparateSequences() throws Exception {
        Path root = Files.createTempDirectory("walker-formats");
        for (int frame = 1; frame <= 10; frame++) {
            Files.writeString(root.resolve(String.format("render.%04d.exr", frame)), "exr");
            Files.writeString(root.resolve(String.format("render.%04d.jpg", frame)), "jp");
        }

        UnitSource source = walker.walk(root, AppendageType.FOLDER);
        List<TransferUnit> units = source.stream().toList();

        List<TransferUnit> sequences = units.stream()
                .filter(unit -> unit.type() == AppendageType.IMAGE_SEQUENCE)
                .toList();
        assertEquals(List.of("render_exr", "render_jpg"), sequences.stream().map(TransferUnit::name).toList());
        assertEquals(10, sequences.get(0).members().size());
        assertTrue(sequences.get(0).members().stream().allMatch(name -> name.endsWith(".exr")));
        assertEquals(20L, sequences.get(1).size());
        assertEquals(3, units.size());
        assertTrue(source.diagnostics().isEmpty());
    }

    @Test
    void mispaddedFrameDegradesOnlyItsOwnFormat() throws Exception {
        Path root = Files.createTempDirectory("walker-formats-ambiguous");
        for (int frame = 1; frame <= 4; frame++) {
            String exr = frame == 3 ? "render.03.exr" : String.format("render.%04d.exr", frame);
            Files.writeString(root.resolve(exr), "exr");
            Files.writeString(root.resolve(String.format("render.%04d.jpg", frame)), "jp");
        }

        UnitSource source = walker.walk(root, AppendageType.FOLDER);
        List<TransferUnit> units = source.stream().toList();

        assertEquals(List.of("render_jpg"), units.stream()
                .filter(unit -> unit.type() == AppendageType.IMAGE_SEQUENCE)
                .map(TransferUnit::name)
                .toList());
        assertEquals(4, units.stream().filter(unit -> unit.type() == AppendageType.FILE).count());
        assertEquals(1, source.diagnostics().size());
        assertTrue(source.diagnostics().get(0).relativePath().endsWith("/render_exr"));
    }

    @Test
    void walkingTwiceYieldsTheSameUnits() throws Exception {
        Path root = Files.createTempDirectory("walker-idem");
        Files.createDirectories(root.resolve("shots/sh010"));
        Files.writeString(root.resolve("shots/sh010/plate.0001.exr"), "a");
        Files.writeString(root.resolve("shots/sh010/plate.0002.exr"), "b");
        Files.writeString(root.resolve("shots/readme.md"), "c");

        List<String> first = describe(walker.walk(root, null));
        List<String> second = describe(walker.walk(root, null));

        assertEquals(first, second);
        assertTrue(first.stream().anyMatch(line -> line.contains("IMAGE_SEQUENCE") && line.contains("plate")));
    }

    @Test
    void sourceIsSingleUse() throws Exception {
        Path root = Files.createTempDirectory("walker-once");
        Files.writeString(root.resolve("a.txt"), "a");
        UnitSource source = walker.walk(root, null);

        assertEquals(2, source.stream().count());
        assertFalse(source.hasNext());
    }

    @Test
    void skipsExcludedFilesAndDirectories() throws Exception {
        Path root = Files.createTempDirectory("walker-exclude");
        Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve(".git/HEAD"), "ref");
        Files.writeString(root.resolve("Thumbs.db"), "x");
        Files.writeString(root.resolve("keep.txt"), "k");

        List<String> names = walker.walk(root, null).stream().map(TransferUnit::name).toList();

        assertEquals(List.of(root.getFileName().toString(), "keep.txt"), names);
    }

    @Test
    void missingRootFailsWithLocalIoError() {
        Path missing = Path.of("does-not-exist-" + System.nanoTime());
        assertThrows(LocalIoException.class, () -> walker.walk(missing, null));
        assertThrows(LocalIoException.class, () -> walker.singleFile(missing));
    }

    @Test
    void explicitFramesMustShareAFolder() throws Exception {
        Path first = Files.createTempDirectory("frames-a");
        Path second = Files.createTempDirectory("frames-b");
        Path a = Files.writeString(first.resolve("f_0001.png"), "a");
        Path b = Files.writeString(second.resolve("f_0002.png"), "b");

        assertThrows(IllegalArgumentException.class, () -> walker.imageSequence(List.of(a, b)));
    }

    @Test
    void explicitFramesBecomeOneSequenceUnit() throws Exception {
        Path folder = Files.createTempDirectory("frames");
        List<Path> frames = new ArrayList<>();
        for (int frame = 3; frame >= 1; frame--) {
            frames.add(Files.writeString(folder.resolve("shot_v2." + frame + "0.jpg"), "f"));
        }

        List<TransferUnit> units = walker.imageSequence(frames).stream().toList();

        assertEquals(1, units.size());
        assertEquals(AppendageType.IMAGE_SEQUENCE, units.get(0).type());
        assertEquals(List.of("shot_v2.10.jpg", "shot_v2.20.jpg", "shot_v2.30.jpg"), units.get(0).members());
    }

    private static List<String> describe(UnitSource source) {
        return source.stream()
                .map(unit -> unit.index() + ":" + unit.parentIndex() + ":" + unit.type() + ":" + unit.relativePath()
                        + ":" + unit.members().stream().collect(Collectors.joining(",")))
                .toList();
    }
}
