package com.ttennebkram.imageeditor.model;

/**
 * Per-channel intensity counts (256 bins each for red, green and blue).
 * {@code maxValue} is the largest bin over all three channels, kept for display scaling.
 */
public final class ImageHistogram {

    public static final int BINS = 256;

    public enum Channel { RED, GREEN, BLUE }

    private final int[] redChannel;
    private final int[] greenChannel;
    private final int[] blueChannel;
    private final int maxValue;

    public ImageHistogram(int[] redChannel, int[] greenChannel, int[] blueChannel) {
        this.redChannel = checkBins(redChannel, "red");
        this.greenChannel = checkBins(greenChannel, "green");
        this.blueChannel = checkBins(blueChannel, "blue");
        this.maxValue = Math.max(max(this.redChannel), Math.max(max(this.greenChannel), max(this.blueChannel)));
    }

    private static int[] checkBins(int[] bins, String name) {
        if (bins == null || bins.length != BINS) {
            throw new IllegalArgumentException("The " + name + " channel needs exactly " + BINS + " bins");
        }
        return bins.clone();
    }

    private static int max(int[] bins) {
        int max = 0;
        for (int v : bins) {
            if (v > max) max = v;
        }
        return max;
    }

    public int[] getRedChannel() {
        return redChannel.clone();
    }

    public int[] getGreenChannel() {
        return greenChannel.clone();
    }

    public int[] getBlueChannel() {
        return blueChannel.clone();
    }

    public int getMaxValue() {
        return maxValue;
    }

    public int count(Channel channel, int level) {
        return bins(channel)[level];
    }

    public long totalCount(Channel channel) {
        long total = 0;
        for (int v : bins(channel)) {
            total += v;
        }
        return total;
    }

    private int[] bins(Channel channel) {
        switch (channel) {
            case RED: return redChannel;
            case GREEN: return greenChannel;
            default: return blueChannel;
        }
    }
}
