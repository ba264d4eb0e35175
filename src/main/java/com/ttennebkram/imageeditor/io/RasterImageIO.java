package com.ttennebkram.imageeditor.io;

import com.ttennebkram.imageeditor.model.RasterBuffer;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads image files into BGRA buffers and writes buffers back out, via OpenCV's codecs.
 */
public class RasterImageIO {

    private static final Logger logger = Logger.getLogger(RasterImageIO.class.getName());

    public static final int DEFAULT_JPEG_QUALITY = 95;

    public RasterBuffer read(Path path) throws ImageFileException {
        if (!Files.isRegularFile(path)) {
            throw new ImageFileException("Image file not found: " + path);
        }
        OpenCvLoader.ensureLoaded();

        Mat mat = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_UNCHANGED);
        try {
            if (mat.empty()) {
                throw new ImageFileException(
                        "Failed to load image. The file may be corrupted or in an unsupported format: " + path);
            }
            RasterBuffer buffer = MatConverter.fromMat(mat);
            logger.info("Read " + path.getFileName() + " (" + buffer.getWidth() + "x" + buffer.getHeight() + ")");
            return buffer;
        } catch (CvException | IllegalArgumentException e) {
            throw new ImageFileException("Failed to decode " + path + ": " + e.getMessage(), e);
        } finally {
            mat.release();
        }
    }

    public void write(RasterBuffer buffer, Path path) throws ImageFileException {
        write(buffer, path, DEFAULT_JPEG_QUALITY);
    }

    /**
     * Encode by extension: .jpg/.jpeg as JPEG with the given quality, .bmp as BMP, anything else PNG.
     * JPEG and BMP drop the alpha channel.
     */
    public void write(RasterBuffer buffer, Path path, int jpegQuality) throws ImageFileException {
        if (buffer.getPixelCount() == 0) {
            throw new ImageFileException("Cannot save an empty image to " + path);
        }
        OpenCvLoader.ensureLoaded();

        ImageFormat format = ImageFormat.forPath(path);
        Mat bgra = MatConverter.toMat(buffer);
        Mat encoded = bgra;
        MatOfInt params = format == ImageFormat.JPEG
                ? new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, Math.max(1, Math.min(100, jpegQuality)))
                : new MatOfInt();
        try {
            if (!format.keepsAlpha()) {
                encoded = new Mat();
                Imgproc.cvtColor(bgra, encoded, Imgproc.COLOR_BGRA2BGR);
            }
            if (!Imgcodecs.imwrite(path.toString(), encoded, params)) {
                throw new ImageFileException("Failed to save image to " + path);
            }
            logger.info("Wrote " + path.getFileName() + " as " + format);
        } catch (CvException e) {
            throw new ImageFileException("Failed to encode " + path + ": " + e.getMessage(), e);
        } finally {
            if (encoded != bgra) encoded.release();
            bgra.release();
            params.release();
        }
    }
}
