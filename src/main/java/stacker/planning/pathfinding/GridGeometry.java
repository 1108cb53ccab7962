package stacker.planning.pathfinding;

import stacker.domain.Cell;
import stacker.domain.HeightGrid;

/**
 * Triangle soup for a height grid: a thin ground slab under the whole grid
 * plus one cube per stacked block. Pure function of the grid.
 */
public final class GridGeometry {
    
    /** Thickness of the ground slab below y = 0 */
    public static final double GROUND_THICKNESS = 0.2;
    
    // Two triangles per face, counter-clockwise seen from outside
    private static final int[][] BOX_FACES = {
        {0, 1, 2, 0, 2, 3},
        {4, 6, 5, 4, 7, 6},
        {4, 5, 1, 4, 1, 0},
        {3, 2, 6, 3, 6, 7},
        {1, 5, 6, 1, 6, 2},
        {4, 0, 3, 4, 3, 7},
    };
    
    /** Flat x,y,z triples */
    private final float[] vertices;
    
    /** Three vertex indices per triangle */
    private final int[] indices;
    
    private GridGeometry(float[] vertices, int[] indices) {
        this.vertices = vertices;
        this.indices = indices;
    }
    
    /**
     * Builds the geometry for a grid.
     * 
     * @param grid the height grid
     * @return vertices and indices of every box
     */
    public static GridGeometry build(HeightGrid grid) {
        int boxes = 1 + grid.totalBlocks();
        float[] vertices = new float[boxes * 8 * 3];
        int[] indices = new int[boxes * 36];
        int[] cursor = {0, 0};
        
        double size = HeightGrid.BLOCK_SIZE;
        addBox(vertices, indices, cursor, 0, -GROUND_THICKNESS, 0,
                grid.getWidth() * size, GROUND_THICKNESS, grid.getDepth() * size);
        for (int x = 0; x < grid.getWidth(); x++) {
            for (int z = 0; z < grid.getDepth(); z++) {
                int height = grid.get(Cell.of(x, z));
                for (int h = 0; h < height; h++) {
                    addBox(vertices, indices, cursor, x * size, h * size, z * size, size, size, size);
                }
            }
        }
        return new GridGeometry(vertices, indices);
    }
    
    private static void addBox(float[] vertices, int[] indices, int[] cursor,
                               double x, double y, double z, double w, double h, double d) {
        int baseIndex = cursor[0] / 3;
        double[][] corners = {
            {x, y, z}, {x + w, y, z}, {x + w, y, z + d}, {x, y, z + d},
            {x, y + h, z}, {x + w, y + h, z}, {x + w, y + h, z + d}, {x, y + h, z + d},
        };
        for (double[] corner : corners) {
            vertices[cursor[0]++] = (float) corner[0];
            vertices[cursor[0]++] = (float) corner[1];
            vertices[cursor[0]++] = (float) corner[2];
        }
        for (int[] face : BOX_FACES) {
            for (int index : face) {
                indices[cursor[1]++] = baseIndex + index;
            }
        }
    }
    
    public int getVertexCount() { return vertices.length / 3; }
    public int getTriangleCount() { return indices.length / 3; }
    
    float vertex(int index, int axis) {
        return vertices[index * 3 + axis];
    }
    
    int index(int i) {
        return indices[i];
    }
    
    int indexCount() {
        return indices.length;
    }
}
