package com.ttennebkram.stylize.io;

import com.ttennebkram.stylize.config.OutputFormat;
import com.ttennebkram.stylize.error.FatalIOException;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and writes raster images. In memory, images are RGB; on disk OpenCV's BGR order is used.
 */
public final class ImageFiles {

    private static final Logger log = LoggerFactory.getLogger(ImageFiles.class);

    public static final Set<String> INPUT_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "tif", "tiff");

    private ImageFiles() {
    }

    /**
     * True if the file name has a supported input extension, in any case.
     */
    public static boolean isSupportedImage(Path path) {
        String ext = extension(path);
        return ext != null && INPUT_EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT));
    }

    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && dot < name.length() - 1 ? name.substring(dot + 1) : null;
    }

    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Load an image as CV_8UC3 RGB.
     *
     * @throws FatalIOException if the file is missing or cannot be decoded
     */
    public static Mat read(Path path) {
        OpenCVLoader.ensureLoaded();
        if (!Files.isRegularFile(path)) {
            throw new FatalIOException("Input image not found: " + path);
        }
        Mat bgr = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        if (bgr.empty()) {
            throw new FatalIOException("Could not decode image: " + path);
        }
        Mat rgb = new Mat();
        Imgproc.cvtColor(bgr, rgb, Imgproc.COLOR_BGR2RGB);
        bgr.release();
        return rgb;
    }

    /**
     * Write a CV_8UC3 RGB image, creating parent directories as needed.
     *
     * @throws FatalIOException if the directory cannot be created or encoding fails
     */
    public static void write(Mat rgb, Path path, OutputFormat format, int quality) {
        OpenCVLoader.ensureLoaded();
        if (rgb == null || rgb.empty() || rgb.type() != CvType.CV_8UC3) {
            throw new FatalIOException("Refusing to write " + path + ": expected a CV_8UC3 image");
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new FatalIOException("Cannot create output directory " + parent + ": " + e.getMessage(), e);
            }
        }
        Mat bgr = new Mat();
        Imgproc.cvtColor(rgb, bgr, Imgproc.COLOR_RGB2BGR);
        boolean ok;
        try {
            ok = Imgcodecs.imwrite(path.toString(), bgr, format.encoderParams(quality));
        } finally {
            bgr.release();
        }
        if (!ok) {
            throw new FatalIOException("Failed to write image " + path + " as " + format.getKey());
        }
        log.debug("Wrote {} ({}x{})", path, rgb.cols(), rgb.rows());
    }
}
