package gov.nih.ncats.molrender.internal.util;

import java.awt.geom.Line2D;
import java.awt.geom.Point2D;


public class GeomUtil {
    public static final double EPS = 0.0001;

    private GeomUtil(){
    }

    public static double angle (Point2D p0, Point2D p1) {
        return angle (p0.getX(), p0.getY(), p1.getX(), p1.getY());
    }

    /**
     * calculate angle between (x0,y0) and (x1,y1) in radians
     */
    public static double angle (double x0, double y0, double x1, double y1) {
        double dx = x1 - x0, dy = y1 - y0;
        return Math.atan2(dy, dx);
    }

    /**
     * Point at the given distance from p in the direction of the angle (radians).
     */
    public static Point2D polar (Point2D p, double angle, double len) {
        return new Point2D.Double(p.getX() + len * Math.cos(angle),
                                  p.getY() + len * Math.sin(angle));
    }

    public static double length (Line2D l) {
        return l.getP1().distance(l.getP2());
    }

    /**
     * Copy of the line moved sideways by the given distance. Positive
     * offsets move to the left of the direction P1 to P2 in a y-down frame.
     */
    public static Line2D offset (Line2D l, double d) {
        double len = length(l);
        if (len < EPS) {
            return new Line2D.Double(l.getP1(), l.getP2());
        }
        double nx = (l.getY2() - l.getY1()) / len * d;
        double ny = -(l.getX2() - l.getX1()) / len * d;
        return new Line2D.Double(l.getX1() + nx, l.getY1() + ny,
                                 l.getX2() + nx, l.getY2() + ny);
    }

    /**
     * Pulls each end of the line toward the other by the given amounts.
     * The line is never shortened past its midpoint.
     */
    public static Line2D shorten (Line2D l, double fromStart, double fromEnd) {
        double len = length(l);
        if (len < EPS) {
            return new Line2D.Double(l.getP1(), l.getP2());
        }
        double max = len / 2;
        double s = Math.min(Math.max(0, fromStart), max) / len;
        double e = Math.min(Math.max(0, fromEnd), max) / len;
        double dx = l.getX2() - l.getX1();
        double dy = l.getY2() - l.getY1();
        return new Line2D.Double(l.getX1() + dx * s, l.getY1() + dy * s,
                                 l.getX2() - dx * e, l.getY2() - dy * e);
    }
}
