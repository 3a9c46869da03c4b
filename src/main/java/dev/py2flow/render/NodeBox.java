package dev.py2flow.render;

/**
 * Placed node of a {@link FlowLayout}. Coordinates are the top-left corner.
 */
public record NodeBox(String name, boolean dataset, int layer, int x, int y, int width, int height) {

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }

    public int right() {
        return x + width;
    }
}
