package stacker.planning.pathfinding;

import java.util.Arrays;

/**
 * Generates a {@link NavMesh} from grid geometry.
 * 
 * Every upward-facing triangle within the slope limit is rasterised onto the
 * columns whose centres it covers; a column's walkable surface is the highest
 * such triangle. Stacked cubes hide the tops of the cubes beneath them, so
 * taking the maximum per column is enough.
 */
public final class NavMeshBuilder {
    
    private static final double EPSILON = 1e-6;
    
    private NavMeshBuilder() {}
    
    /**
     * @param geometry triangle soup of the world
     * @param options fixed tuning data
     * @return the walkable surfaces and their links
     */
    public static NavMesh generate(GridGeometry geometry, NavMeshOptions options) {
        double maxX = 0;
        double maxZ = 0;
        for (int v = 0; v < geometry.getVertexCount(); v++) {
            maxX = Math.max(maxX, geometry.vertex(v, 0));
            maxZ = Math.max(maxZ, geometry.vertex(v, 2));
        }
        int width = (int) Math.round(maxX / options.cellSize);
        int depth = (int) Math.round(maxZ / options.cellSize);
        
        double[][] surfaceY = new double[width][depth];
        for (double[] column : surfaceY) {
            Arrays.fill(column, Double.NaN);
        }
        
        double minNormalY = Math.cos(Math.toRadians(options.walkableSlopeAngleDegrees));
        for (int i = 0; i + 2 < geometry.indexCount(); i += 3) {
            int a = geometry.index(i);
            int b = geometry.index(i + 1);
            int c = geometry.index(i + 2);
            
            double ax = geometry.vertex(a, 0), ay = geometry.vertex(a, 1), az = geometry.vertex(a, 2);
            double bx = geometry.vertex(b, 0), by = geometry.vertex(b, 1), bz = geometry.vertex(b, 2);
            double cx = geometry.vertex(c, 0), cy = geometry.vertex(c, 1), cz = geometry.vertex(c, 2);
            
            // Normal = (b - a) x (c - a)
            double ux = bx - ax, uy = by - ay, uz = bz - az;
            double wx = cx - ax, wy = cy - ay, wz = cz - az;
            double nx = uy * wz - uz * wy;
            double ny = uz * wx - ux * wz;
            double nz = ux * wy - uy * wx;
            double length = Math.sqrt(nx * nx + ny * ny + nz * nz);
            if (length < EPSILON || ny / length < minNormalY) continue;
            
            double top = Math.max(ay, Math.max(by, cy));
            rasterise(surfaceY, options.cellSize, top, ax, az, bx, bz, cx, cz);
        }
        return new NavMesh(width, depth, surfaceY, options);
    }
    
    private static void rasterise(double[][] surfaceY, double cellSize, double top,
                                  double ax, double az, double bx, double bz, double cx, double cz) {
        int minX = Math.max(0, (int) Math.floor(Math.min(ax, Math.min(bx, cx)) / cellSize));
        int maxX = Math.min(surfaceY.length - 1, (int) Math.floor(Math.max(ax, Math.max(bx, cx)) / cellSize));
        int minZ = Math.max(0, (int) Math.floor(Math.min(az, Math.min(bz, cz)) / cellSize));
        int maxZ = surfaceY.length == 0 ? -1
                : Math.min(surfaceY[0].length - 1, (int) Math.floor(Math.max(az, Math.max(bz, cz)) / cellSize));
        
        for (int x = minX; x <= maxX; x++) {
            for (int z = minZ; z <= maxZ; z++) {
                double px = (x + 0.5) * cellSize;
                double pz = (z + 0.5) * cellSize;
                if (!containsPoint(ax, az, bx, bz, cx, cz, px, pz)) continue;
                if (Double.isNaN(surfaceY[x][z]) || top > surfaceY[x][z]) {
                    surfaceY[x][z] = top;
                }
            }
        }
    }
    
    // Inclusive point-in-triangle test in the x/z plane
    private static boolean containsPoint(double ax, double az, double bx, double bz,
                                         double cx, double cz, double px, double pz) {
        double d1 = edgeSign(px, pz, ax, az, bx, bz);
        double d2 = edgeSign(px, pz, bx, bz, cx, cz);
        double d3 = edgeSign(px, pz, cx, cz, ax, az);
        boolean hasNegative = d1 < -EPSILON || d2 < -EPSILON || d3 < -EPSILON;
        boolean hasPositive = d1 > EPSILON || d2 > EPSILON || d3 > EPSILON;
        return !(hasNegative && hasPositive);
    }
    
    private static double edgeSign(double px, double pz, double ax, double az, double bx, double bz) {
        return (px - bx) * (az - bz) - (ax - bx) * (pz - bz);
    }
}
