package github.sarthakdev143.scene_factory.service;

import github.sarthakdev143.scene_factory.exception.AssemblyException;
import github.sarthakdev143.scene_factory.model.MediaProbe;
import github.sarthakdev143.scene_factory.model.assembly.CrossfadePlan;

import java.nio.file.Path;
import java.util.List;

/**
 * Blocking operations on local media files. Callers run these off request threads.
 */
public interface MediaTranscoder {

    MediaProbe probe(Path mediaPath) throws AssemblyException, InterruptedException;

    Path extractLastFrame(Path videoPath, Path framePath) throws AssemblyException, InterruptedException;

    Path merge(Path videoPath, Path audioPath, Path outputPath) throws AssemblyException, InterruptedException;

    Path concatCrossfade(CrossfadePlan plan, Path outputPath) throws AssemblyException, InterruptedException;

    Path concatLossless(List<Path> clipPaths, Path outputPath) throws AssemblyException, InterruptedException;
}
