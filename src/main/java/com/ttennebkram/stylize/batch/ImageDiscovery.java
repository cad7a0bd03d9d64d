package com.ttennebkram.stylize.batch;

import com.ttennebkram.stylize.error.DiscoveryException;
import com.ttennebkram.stylize.io.ImageFiles;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lists the supported images directly inside a directory, sorted by file name.
 */
public final class ImageDiscovery {

    private ImageDiscovery() {
    }

    /**
     * @throws DiscoveryException if the directory is missing or cannot be listed
     */
    public static List<Path> discover(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new DiscoveryException("Input directory does not exist: " + directory);
        }
        List<Path> images = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path) && ImageFiles.isSupportedImage(path)) {
                    images.add(path);
                }
            }
        } catch (IOException e) {
            throw new DiscoveryException("Cannot list input directory " + directory + ": " + e.getMessage(), e);
        }
        images.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return images;
    }
}
