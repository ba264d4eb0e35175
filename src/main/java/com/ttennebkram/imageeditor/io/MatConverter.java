package com.ttennebkram.imageeditor.io;

import com.ttennebkram.imageeditor.model.RasterBuffer;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Converts between {@link RasterBuffer} and OpenCV Mat.
 * OpenCV stores color as BGR(A) already, so no channel swizzling is needed.
 */
public final class MatConverter {

    private MatConverter() {
    }

    /**
     * Copy a buffer into a new CV_8UC4 Mat (caller releases).
     */
    public static Mat toMat(RasterBuffer buffer) {
        Mat mat = new Mat(buffer.getHeight(), buffer.getWidth(), CvType.CV_8UC4);
        mat.put(0, 0, buffer.rawBytes());
        return mat;
    }

    /**
     * Copy a 1-, 3- or 4-channel Mat into a BGRA buffer.
     * Deeper than 8-bit images are scaled down to 8 bits. The input Mat is not released.
     */
    public static RasterBuffer fromMat(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Cannot convert an empty Mat");
        }

        Mat eightBit = null;
        Mat bgra = null;
        try {
            Mat source = mat;
            if (mat.depth() != CvType.CV_8U) {
                eightBit = new Mat();
                double scale = mat.depth() == CvType.CV_16U ? 1.0 / 256.0 : 1.0;
                mat.convertTo(eightBit, CvType.CV_8U, scale);
                source = eightBit;
            }

            bgra = new Mat();
            switch (source.channels()) {
                case 1:
                    Imgproc.cvtColor(source, bgra, Imgproc.COLOR_GRAY2BGRA);
                    break;
                case 3:
                    Imgproc.cvtColor(source, bgra, Imgproc.COLOR_BGR2BGRA);
                    break;
                case 4:
                    source.copyTo(bgra);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported channel count: " + source.channels());
            }

            int width = bgra.cols();
            int height = bgra.rows();
            byte[] data = new byte[width * height * RasterBuffer.BYTES_PER_PIXEL];
            bgra.get(0, 0, data);
            return RasterBuffer.wrap(width, height, data);
        } finally {
            if (eightBit != null) eightBit.release();
            if (bgra != null) bgra.release();
        }
    }
}
