package gov.nih.ncats.molrender.internal.algo;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import gov.nih.ncats.molrender.internal.util.ConnectionTable;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Node;
import gov.nih.ncats.molrender.internal.util.GeomUtil;

/**
 * Depth first 2D placement. Every atom gets a position exactly once, bonded
 * atoms along the traversal tree sit one bond length apart and the finished
 * structure is moved so its bounding box is centered on the origin.
 * <p>
 * Angles are in radians in a y-down frame (the frame SVG uses), relative to
 * the direction of the bond the walk arrived through.
 */
public class CoordinateGenerator{
	private static final Logger logger = Logger.getLogger(CoordinateGenerator.class.getName());

	public static final double DEFAULT_BOND_LENGTH = 30;

	private static final double TURN = Math.PI/3;
	//virtual bond into the first atom, from the lower left, so chains zig-zag along the x axis
	private static final double START_DIRECTION = -Math.PI/6;
	private static final double TRIGONAL = 2*Math.PI/3;
	//half the angle between two substituents on the same ring atom
	private static final double GEM_SPREAD = 2*Math.PI/9;
	private static final double NUDGE = Math.PI/12;
	//a target closer than this fraction of a bond to a placed atom counts as taken
	private static final double CROWDED = 0.9;

	private final ConnectionTable ct;
	private final double bondLength;
	private BitSet ringAtoms;

	public CoordinateGenerator(ConnectionTable ct){
		this(ct, DEFAULT_BOND_LENGTH);
	}

	public CoordinateGenerator(ConnectionTable ct, double bondLength){
		if(bondLength<=0){
			throw new IllegalArgumentException("bond length must be > 0");
		}
		this.ct=ct;
		this.bondLength=bondLength;
	}

	/**
	 * Places every atom of the table and re-centers the result.
	 * @return the same table, now laid out.
	 * @throws IllegalStateException if an atom was already placed.
	 */
	public ConnectionTable layout(){
		if(ct.isEmpty()){
			return ct;
		}
		ringAtoms = ct.getRingAtoms();

		int components=0;
		for(Node n : ct.getNodes()){
			if(n.getPoint()!=null){
				continue;
			}
			Point2D origin = ct.getBounds()
					.map(r->(Point2D)new Point2D.Double(r.getMaxX()+2*bondLength, 0))
					.orElse(new Point2D.Double(0, 0));
			n.place(origin);
			placeNeighbors(n, START_DIRECTION, 1, true);
			components++;
		}

		Rectangle2D bounds = ct.getBounds().get();
		ct.applyTransform(AffineTransform.getTranslateInstance(-bounds.getCenterX(), -bounds.getCenterY()));

		String placed = components==1?"1 component":components + " components";
		logger.fine(()->"laid out " + ct.getNodes().size() + " atoms in " + placed + ", extent "
				+ bounds.getWidth() + " x " + bounds.getHeight());
		return ct;
	}

	private void placeNeighbors(Node n, double forward, int turn, boolean start){
		List<Node> todo = n.getNeighborNodes().stream()
				.filter(m->m.getPoint()==null)
				.collect(Collectors.toList());
		int k = todo.size();
		if(k==0){
			return;
		}
		double[] angles = new double[k];
		boolean inRing = ringAtoms.get(n.getIndex());

		if(k==1){
			Node next = todo.get(0);
			if(!inRing){
				angles[0] = forward + turn*TURN;
			}else if(ringAtoms.get(next.getIndex())){
				angles[0] = forward + TURN;
			}else{
				angles[0] = outward(n);
			}
		}else if(k==2){
			if(inRing && ringNeighborCount(todo)==1 && ringAtoms.get(todo.get(0).getIndex())){
				//keep the ring neighbor on the same turn as the rest of the ring
				todo.add(todo.remove(0));
			}
			angles[0] = forward - TURN;
			angles[1] = forward + TURN;
		}else if(k==3 && inRing && ringNeighborCount(todo)==1){
			//ring continues on the usual turn, the two substituents share the outside
			Node ringNext = todo.stream().filter(m->ringAtoms.get(m.getIndex())).findFirst().get();
			todo.remove(ringNext);
			todo.add(0, ringNext);
			angles[0] = forward + TURN;
			angles[1] = forward - TURN + GEM_SPREAD;
			angles[2] = forward - TURN - GEM_SPREAD;
		}else if(k==3){
			angles[0] = forward;
			angles[1] = forward + TRIGONAL;
			angles[2] = forward - TRIGONAL;
		}else if(start){
			for(int i=0;i<k;i++){
				angles[i] = forward + i*2*Math.PI/k;
			}
		}else{
			double back = forward + Math.PI;
			for(int i=0;i<k;i++){
				angles[i] = back + (i+1)*2*Math.PI/(k+1);
			}
		}

		for(int i=0;i<k;i++){
			Node m = todo.get(i);
			//may have been reached around a ring by an earlier sibling
			if(m.getPoint()!=null){
				continue;
			}
			double angle = angles[i];
			//ring bonds keep their angle or the ring would not close
			if(!(inRing && ringAtoms.get(m.getIndex()))){
				angle = findFreeDirection(n.getPoint(), angle);
			}
			m.place(GeomUtil.polar(n.getPoint(), angle, bondLength));
			placeNeighbors(m, angle, -turn, false);
		}
	}

	/**
	 * The given direction if the bond end it leads to is clear of every placed
	 * atom, otherwise the nearest direction in {@link #NUDGE} steps that is.
	 * If no direction is clear the one with the most room is returned.
	 */
	private double findFreeDirection(Point2D from, double preferred){
		double minClearance = CROWDED*bondLength;
		double best = preferred;
		double bestClearance = clearance(GeomUtil.polar(from, preferred, bondLength));
		if(bestClearance >= minClearance){
			return preferred;
		}
		int steps = (int) Math.round(Math.PI/NUDGE);
		for(int j=1;j<steps;j++){
			for(int sign=1; sign>=-1; sign-=2){
				double a = preferred + sign*j*NUDGE;
				double c = clearance(GeomUtil.polar(from, a, bondLength));
				if(c >= minClearance){
					return a;
				}
				if(c > bestClearance){
					best = a;
					bestClearance = c;
				}
			}
		}
		return best;
	}

	private double clearance(Point2D p){
		return ct.getNodes().stream()
				.map(Node::getPoint)
				.filter(q->q!=null)
				.mapToDouble(q->q.distance(p))
				.min()
				.orElse(Double.MAX_VALUE);
	}

	private int ringNeighborCount(List<Node> nodes){
		return (int) nodes.stream().filter(m->ringAtoms.get(m.getIndex())).count();
	}

	/**
	 * Direction pointing away from the already placed neighbors of n.
	 */
	private static double outward(Node n){
		List<Point2D> placed = n.getNeighborNodes().stream()
				.map(Node::getPoint)
				.filter(p->p!=null)
				.collect(Collectors.toList());
		double cx = placed.stream().mapToDouble(Point2D::getX).average().getAsDouble();
		double cy = placed.stream().mapToDouble(Point2D::getY).average().getAsDouble();
		Point2D p = n.getPoint();
		if(p.distance(cx, cy)<GeomUtil.EPS){
			return GeomUtil.angle(placed.get(0), p);
		}
		return GeomUtil.angle(cx, cy, p.getX(), p.getY());
	}
}
