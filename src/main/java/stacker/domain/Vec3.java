package stacker.domain;

import java.util.Locale;

/**
 * Immutable continuous world position. y is up.
 */
public final class Vec3 {
    
    public final double x;
    public final double y;
    public final double z;
    
    public Vec3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }
    
    public double distanceTo(Vec3 other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
    
    /**
     * Distance in the x/z plane, ignoring height.
     */
    public double horizontalDistanceTo(Vec3 other) {
        double dx = x - other.x;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dz * dz);
    }
    
    /**
     * Returns a copy of this position at a different height.
     */
    public Vec3 withY(double newY) {
        return new Vec3(x, newY, z);
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Vec3 other = (Vec3) obj;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0;
    }
    
    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(z);
        return result;
    }
    
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%.2f, %.2f, %.2f]", x, y, z);
    }
}
