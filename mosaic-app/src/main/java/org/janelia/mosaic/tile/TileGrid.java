package org.janelia.mosaic.tile;

import java.awt.Rectangle;
import java.io.Serializable;

/**
 * Partitions an image into a grid of tiles that exactly covers it.
 * Tiles in the last column (or row) are clipped to the remaining width (or height)
 * when the image dimension is not a multiple of the tile dimension.
 */
public class TileGrid implements Serializable {

    private final int masterWidth;
    private final int masterHeight;
    private final int tileWidth;
    private final int tileHeight;
    private final int columns;
    private final int rows;

    /**
     * @throws ZeroAreaRegionException
     *   if the tile width or height is not positive.
     *
     * @throws IllegalArgumentException
     *   if the master width or height is not positive.
     */
    public TileGrid(final int masterWidth,
                    final int masterHeight,
                    final int tileWidth,
                    final int tileHeight)
            throws IllegalArgumentException {

        final int[] dimensions = gridDimensions(masterWidth, masterHeight, tileWidth, tileHeight);

        this.masterWidth = masterWidth;
        this.masterHeight = masterHeight;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.columns = dimensions[0];
        this.rows = dimensions[1];
    }

    /**
     * @return { columns, rows } for a grid covering the specified master dimensions.
     *
     * @throws ZeroAreaRegionException
     *   if the tile width or height is not positive.
     *
     * @throws IllegalArgumentException
     *   if the master width or height is not positive.
     */
    public static int[] gridDimensions(final int masterWidth,
                                       final int masterHeight,
                                       final int tileWidth,
                                       final int tileHeight)
            throws IllegalArgumentException {

        validateTileSize(tileWidth, tileHeight);

        if ((masterWidth < 1) || (masterHeight < 1)) {
            throw new IllegalArgumentException("master dimensions " + masterWidth + "x" + masterHeight +
                                               " must be positive");
        }

        return new int[] { cellCount(masterWidth, tileWidth), cellCount(masterHeight, tileHeight) };
    }

    /**
     * @return pixel rectangle covered by the tile at the specified grid coordinate.
     *
     * @throws IllegalArgumentException
     *   if the grid coordinate is outside the grid.
     */
    public static Rectangle tileRectangle(final int column,
                                          final int row,
                                          final int columns,
                                          final int rows,
                                          final int masterWidth,
                                          final int masterHeight,
                                          final int tileWidth,
                                          final int tileHeight)
            throws IllegalArgumentException {

        if ((column < 0) || (column >= columns) || (row < 0) || (row >= rows)) {
            throw new IllegalArgumentException("tile (" + column + ", " + row + ") is outside " +
                                               columns + "x" + rows + " grid");
        }

        final int widthRemainder = masterWidth % tileWidth;
        final int heightRemainder = masterHeight % tileHeight;

        final int width = ((column == columns - 1) && (widthRemainder != 0)) ? widthRemainder : tileWidth;
        final int height = ((row == rows - 1) && (heightRemainder != 0)) ? heightRemainder : tileHeight;

        return new Rectangle(column * tileWidth, row * tileHeight, width, height);
    }

    public static void validateTileSize(final int tileWidth,
                                        final int tileHeight)
            throws ZeroAreaRegionException {
        if ((tileWidth < 1) || (tileHeight < 1)) {
            throw new ZeroAreaRegionException("tile dimensions " + tileWidth + "x" + tileHeight +
                                              " must be positive");
        }
    }

    public Rectangle getTileRectangle(final int column,
                                      final int row)
            throws IllegalArgumentException {
        return tileRectangle(column, row, columns, rows, masterWidth, masterHeight, tileWidth, tileHeight);
    }

    public int getMasterWidth() {
        return masterWidth;
    }

    public int getMasterHeight() {
        return masterHeight;
    }

    public int getTileWidth() {
        return tileWidth;
    }

    public int getTileHeight() {
        return tileHeight;
    }

    public int getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }

    public int getTileCount() {
        return columns * rows;
    }

    @Override
    public String toString() {
        return "TileGrid{" + columns + "x" + rows + " tiles of " + tileWidth + "x" + tileHeight +
               " covering " + masterWidth + "x" + masterHeight + "}";
    }

    private static int cellCount(final int size,
                                 final int cellSize) {
        final int fullCells = size / cellSize;
        return (size % cellSize == 0) ? fullCells : fullCells + 1;
    }
}
