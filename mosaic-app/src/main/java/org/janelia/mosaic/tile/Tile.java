package org.janelia.mosaic.tile;

import java.awt.Rectangle;

import org.janelia.mosaic.color.ColorRGB;

/**
 * One grid cell of a master image along with its target (average) color.
 */
public class Tile {

    private final int column;
    private final int row;
    private final Rectangle bounds;
    private final ColorRGB targetColor;

    public Tile(final int column,
                final int row,
                final Rectangle bounds,
                final ColorRGB targetColor) {
        this.column = column;
        this.row = row;
        this.bounds = new Rectangle(bounds);
        this.targetColor = targetColor;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    /**
     * @return copy of this tile's pixel rectangle.
     */
    public Rectangle getBounds() {
        return new Rectangle(bounds);
    }

    public ColorRGB getTargetColor() {
        return targetColor;
    }

    @Override
    public String toString() {
        return "Tile{(" + column + ", " + row + ") at " + bounds.x + "," + bounds.y + " " +
               bounds.width + "x" + bounds.height + ", targetColor=" + targetColor + "}";
    }
}
