package com.colorchart.vision.core.marker;

import com.colorchart.vision.core.geometry.Point;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.objdetect.ArucoDetector;
import org.opencv.objdetect.DetectorParameters;
import org.opencv.objdetect.Dictionary;
import org.opencv.objdetect.Objdetect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ArUco 标记检测器
 * <p>
 * 字典必须与打印模板时使用的字典一致（默认 DICT_4X4_100）。
 * 检测在 8 位灰度图上进行，16 位输入会先缩放到 8 位。
 */
public class ArucoMarkerDetector implements MarkerDetector {
    private static final Logger logger = LoggerFactory.getLogger(ArucoMarkerDetector.class);

    public static final int DEFAULT_DICTIONARY = Objdetect.DICT_4X4_100;

    private final int dictionaryId;
    private final boolean subPixelRefinement;

    public ArucoMarkerDetector() {
        this(DEFAULT_DICTIONARY, true);
    }

    public ArucoMarkerDetector(int dictionaryId, boolean subPixelRefinement) {
        this.dictionaryId = dictionaryId;
        this.subPixelRefinement = subPixelRefinement;
    }

    @Override
    public Map<Integer, Marker> detect(Mat image) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Input image is null or empty");
        }

        Mat gray = toGray8(image);
        List<Mat> markerCorners = new ArrayList<>();
        Mat markerIds = new Mat();

        try {
            Dictionary dictionary = Objdetect.getPredefinedDictionary(dictionaryId);
            DetectorParameters params = new DetectorParameters();
            if (subPixelRefinement) {
                params.set_cornerRefinementMethod(Objdetect.CORNER_REFINE_SUBPIX);
            }
            ArucoDetector detector = new ArucoDetector(dictionary, params);
            detector.detectMarkers(gray, markerCorners, markerIds);

            if (markerIds.empty()) {
                logger.info("ArUco: no markers detected");
                return Collections.emptyMap();
            }

            int[] ids = new int[(int) markerIds.total()];
            markerIds.get(0, 0, ids);

            Map<Integer, Marker> markers = new LinkedHashMap<>();
            for (int i = 0; i < ids.length; i++) {
                int id = ids[i];
                if (markers.containsKey(id)) {
                    logger.warn("ArUco: marker id {} detected more than once, keeping the first", id);
                    continue;
                }

                float[] data = new float[8];
                markerCorners.get(i).get(0, 0, data);
                Point[] corners = new Point[4];
                for (int j = 0; j < 4; j++) {
                    corners[j] = new Point(data[2 * j], data[2 * j + 1]);
                }
                markers.put(id, new Marker(id, corners));
            }

            logger.info("ArUco: detected marker ids {}", markers.keySet());
            return markers;

        } finally {
            if (gray != image) {
                gray.release();
            }
            markerIds.release();
            for (Mat m : markerCorners) {
                m.release();
            }
        }
    }

    /**
     * 转为 8 位单通道灰度图
     */
    static Mat toGray8(Mat image) {
        Mat gray;
        switch (image.channels()) {
            case 1:
                gray = image;
                break;
            case 3:
                gray = new Mat();
                Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
                break;
            case 4:
                gray = new Mat();
                Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
                break;
            default:
                throw new IllegalArgumentException("Unsupported channel count: " + image.channels());
        }

        if (gray.depth() == CvType.CV_8U) {
            return gray;
        }

        Mat gray8 = new Mat();
        double scale = gray.depth() == CvType.CV_16U ? 1.0 / 257.0 : 1.0;
        gray.convertTo(gray8, CvType.CV_8U, scale);
        if (gray != image) {
            gray.release();
        }
        return gray8;
    }
}
