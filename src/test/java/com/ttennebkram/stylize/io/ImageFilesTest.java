package com.ttennebkram.stylize.io;

import com.ttennebkram.stylize.TestImages;
import com.ttennebkram.stylize.config.OutputFormat;
import com.ttennebkram.stylize.error.FatalIOException;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageFilesTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    @Test
    void writeThenRead_pngIsLossless() {
        Mat image = TestImages.portrait(32, 24);
        Path file = tempDir.resolve("nested/dir/out.png");

        ImageFiles.write(image, file, OutputFormat.PNG, 95);
        Mat loaded = ImageFiles.read(file);

        assertEquals(CvType.CV_8UC3, loaded.type());
        assertArrayEquals(TestImages.bytes(image), TestImages.bytes(loaded));
    }

    @Test
    void write_jpegProducesFile() {
        Path file = tempDir.resolve("out.jpg");

        ImageFiles.write(TestImages.portrait(32, 24), file, OutputFormat.JPEG, 80);

        assertTrue(Files.isRegularFile(file));
    }

    @Test
    void read_missingFileThrows() {
        assertThrows(FatalIOException.class, () -> ImageFiles.read(tempDir.resolve("absent.png")));
    }

    @Test
    void read_undecodableFileThrows() throws Exception {
        Path file = Files.writeString(tempDir.resolve("broken.png"), "not an image");

        assertThrows(FatalIOException.class, () -> ImageFiles.read(file));
    }

    @Test
    void write_rejectsNonDisplayImages() {
        Mat floats = new Mat(4, 4, CvType.CV_32FC3);

        assertThrows(FatalIOException.class,
                () -> ImageFiles.write(floats, tempDir.resolve("f.png"), OutputFormat.PNG, 95));
    }

    @Test
    void isSupportedImage_ignoresCase() {
        assertTrue(ImageFiles.isSupportedImage(Path.of("a.JPG")));
        assertTrue(ImageFiles.isSupportedImage(Path.of("b.tiff")));
        assertFalse(ImageFiles.isSupportedImage(Path.of("c.gif")));
        assertFalse(ImageFiles.isSupportedImage(Path.of("noext")));
    }

    @Test
    void stemAndExtension() {
        assertEquals("photo.final", ImageFiles.stem(Path.of("dir/photo.final.png")));
        assertEquals("png", ImageFiles.extension(Path.of("dir/photo.final.png")));
        assertEquals(".hidden", ImageFiles.stem(Path.of(".hidden")));
        assertNull(ImageFiles.extension(Path.of("trailing.")));
    }
}
