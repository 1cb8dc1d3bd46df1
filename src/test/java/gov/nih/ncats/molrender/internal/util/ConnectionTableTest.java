package gov.nih.ncats.molrender.internal.util;

import static org.junit.Assert.*;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import org.junit.Test;

import gov.nih.ncats.molrender.internal.algo.SmilesParser;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.BondOrder;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Edge;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Node;

public class ConnectionTableTest {

    private static ConnectionTable parse(String smiles){
        return new SmilesParser(smiles).getCtab();
    }

    @Test
    public void indicesFollowInsertionOrder(){
        ConnectionTable ct = new ConnectionTable();
        Node a = ct.addNode("C");
        Node b = ct.addNode("O");
        Edge e = ct.addEdge(a.getIndex(), b.getIndex(), BondOrder.DOUBLE);

        assertEquals(0, a.getIndex());
        assertEquals(1, b.getIndex());
        assertEquals(0, e.getIndex());
        assertSame(b, e.getOtherNode(a));
        assertSame(a, e.getOtherNode(b));
        assertEquals(1, a.getEdgeCount());
        assertTrue(b.connectsTo(a));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void edgeToUnknownNodeIsRejected(){
        ConnectionTable ct = new ConnectionTable();
        ct.addNode("C");
        ct.addEdge(0, 5, BondOrder.SINGLE);
    }

    @Test(expected = IllegalStateException.class)
    public void positionIsWrittenOnce(){
        ConnectionTable ct = new ConnectionTable();
        Node n = ct.addNode("C");
        n.place(new Point2D.Double(0, 0));
        n.place(new Point2D.Double(1, 1));
    }

    @Test
    public void implicitHydrogens(){
        ConnectionTable ethanol = parse("CCO");
        assertEquals(3, ethanol.getNode(0).getImplicitHydrogens());
        assertEquals(2, ethanol.getNode(1).getImplicitHydrogens());
        assertEquals(1, ethanol.getNode(2).getImplicitHydrogens());

        ConnectionTable formaldehyde = parse("C=O");
        assertEquals(2, formaldehyde.getNode(0).getImplicitHydrogens());
        assertEquals(0, formaldehyde.getNode(1).getImplicitHydrogens());

        assertEquals(1, parse("c1ccccc1").getNode(0).getImplicitHydrogens());
        assertEquals(0, parse("[O-]C").getNode(0).getImplicitHydrogens());
        assertEquals(0, parse("[Xe]").getNode(0).getImplicitHydrogens());
        assertEquals(3, parse("B").getNode(0).getImplicitHydrogens());
    }

    @Test
    public void explicitHydrogenCountWins(){
        assertEquals(4, parse("[NH4+]").getNode(0).getImplicitHydrogens());
    }

    @Test
    public void standardValence(){
        assertEquals(4, ConnectionTable.getStandardValence("C"));
        assertEquals(1, ConnectionTable.getStandardValence("Cl"));
        assertEquals(0, ConnectionTable.getStandardValence("Na"));
    }

    @Test
    public void ringAtomsAreRecomputedAfterChange(){
        ConnectionTable ct = parse("CCC");
        assertTrue(ct.getRingAtoms().isEmpty());
        ct.addEdge(2, 0, BondOrder.SINGLE);
        assertEquals(3, ct.getRingAtoms().cardinality());
        assertTrue(ct.getNode(1).isInRing());
    }

    @Test
    public void boundsAndTransform(){
        ConnectionTable ct = parse("CC");
        assertFalse(ct.getBounds().isPresent());
        assertFalse(ct.isLaidOut());

        ct.getNode(0).place(new Point2D.Double(0, 0));
        ct.getNode(1).place(new Point2D.Double(30, 10));
        assertTrue(ct.isLaidOut());

        ct.applyTransform(AffineTransform.getTranslateInstance(-15, -5));
        Rectangle2D r = ct.getBounds().get();
        assertEquals(0, r.getCenterX(), 0.0001);
        assertEquals(0, r.getCenterY(), 0.0001);
        assertEquals(30, r.getWidth(), 0.0001);
    }
}
