package com.projectgroup5.dogfight.game;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * 网络上的向量用 double[] 表示，这里做 vecmath 之间的转换
 */
public final class Vectors {

    public static final double EPSILON = 1e-9;

    private Vectors() {
    }

    public static Point3d point(double[] xyz) {
        return new Point3d(xyz[0], xyz[1], xyz[2]);
    }

    public static Vector3d vector(double[] xyz) {
        return new Vector3d(xyz[0], xyz[1], xyz[2]);
    }

    /** [x, y, z, w]，调用前需保证不是零四元数 */
    public static Quat4d quat(double[] xyzw) {
        return new Quat4d(xyzw[0], xyzw[1], xyzw[2], xyzw[3]);
    }

    public static double[] toArray(Tuple3d t) {
        return new double[]{t.x, t.y, t.z};
    }

    public static double[] toArray(Quat4d q) {
        return new double[]{q.x, q.y, q.z, q.w};
    }

    public static Quat4d identity() {
        return new Quat4d(0, 0, 0, 1);
    }

    public static boolean isFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    public static double length(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }
}
