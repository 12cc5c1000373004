package com.visionsentinel.core.support;

import com.visionsentinel.core.source.Frame;

/**
 * Pixel-less frame carrying only its dimensions.
 */
public final class TestFrame implements Frame {

    private final int width;
    private final int height;

    public TestFrame(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public static TestFrame hd() {
        return new TestFrame(1280, 720);
    }

    public static TestFrame vga() {
        return new TestFrame(640, 480);
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public Frame resize(int newWidth, int newHeight) {
        return new TestFrame(newWidth, newHeight);
    }
}
