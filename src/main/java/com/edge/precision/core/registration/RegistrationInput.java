package com.edge.precision.core.registration;

import org.opencv.core.Mat;

/**
 * 配准输入：理想图与实测图（可为空，此时图像类方法直接失败）
 */
public class RegistrationInput {
    private final Mat idealImage;
    private final Mat realImage;

    public RegistrationInput(Mat idealImage, Mat realImage) {
        this.idealImage = idealImage;
        this.realImage = realImage;
    }

    public static RegistrationInput withoutImages() {
        return new RegistrationInput(null, null);
    }

    public boolean hasImages() {
        return idealImage != null && realImage != null && !idealImage.empty() && !realImage.empty();
    }

    public Mat getIdealImage() {
        return idealImage;
    }

    public Mat getRealImage() {
        return realImage;
    }
}
