package gov.nih.ncats.molrender.internal.util;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import gov.nih.ncats.molrender.internal.algo.RingClassifier;

/**
 * Arena style molecular graph. Nodes and edges live in two lists owned by the
 * table; an {@link Edge} refers to its atoms by index and a {@link Node} keeps
 * the indices of its edges, so there are no object cycles between them.
 */
public class ConnectionTable{
	private final List<Node> nodes = new ArrayList<Node>();
	private final List<Edge> edges = new ArrayList<Edge>();

	private static final Map<String,Integer> STANDARD_VALENCE;
	static{
		Map<String,Integer> val = new HashMap<>();
		val.put("C", 4);
		val.put("N", 3);
		val.put("O", 2);
		val.put("S", 2);
		val.put("P", 3);
		val.put("B", 3);
		val.put("F", 1);
		val.put("Cl", 1);
		val.put("Br", 1);
		val.put("I", 1);
		STANDARD_VALENCE = Collections.unmodifiableMap(val);
	}

	private CachedSupplier<BitSet> _ringAtoms = CachedSupplier.of(()->RingClassifier.findRingAtoms(this));

	public enum BondOrder{
		SINGLE(1),
		AROMATIC(1.5),
		DOUBLE(2),
		TRIPLE(3);

		private final double value;

		BondOrder(double value){
			this.value=value;
		}

		public double getValue(){
			return value;
		}
	}

	public enum BondStereo{
		NONE,
		/** "/" in the notation, drawn as a filled wedge */
		UP,
		/** "\" in the notation, drawn as a hashed / dashed segment */
		DOWN
	}

	public enum Chirality{
		NONE(""),
		ANTICLOCKWISE("@"),
		CLOCKWISE("@@");

		private final String symbol;

		Chirality(String symbol){
			this.symbol=symbol;
		}

		public String getSymbol(){
			return symbol;
		}
	}

	public static int getStandardValence(String symbol){
		return STANDARD_VALENCE.getOrDefault(symbol, 0);
	}

	public Node addNode(String symbol){
		Node n=new Node(nodes.size(),symbol);
		nodes.add(n);
		resetCaches();
		return n;
	}

	/**
	 * Connect the two given node offsets.
	 * @throws IndexOutOfBoundsException if either offset is not a node of this table.
	 */
	public Edge addEdge(int n1, int n2, BondOrder o){
		Node a = nodes.get(n1);
		Node b = nodes.get(n2);
		Edge e=new Edge(edges.size(),n1,n2,o);
		edges.add(e);
		a.edgeOffsets.add(e.getIndex());
		b.edgeOffsets.add(e.getIndex());
		resetCaches();
		return e;
	}

	private void resetCaches(){
		_ringAtoms.resetCache();
	}

	public List<Node> getNodes() {
		return Collections.unmodifiableList(this.nodes);
	}

	public List<Edge> getEdges() {
		return Collections.unmodifiableList(this.edges);
	}

	public Node getNode(int i){
		return nodes.get(i);
	}

	public Edge getEdge(int i){
		return edges.get(i);
	}

	public boolean isEmpty(){
		return nodes.isEmpty();
	}

	/**
	 * Offsets of all nodes that lie on at least one cycle.
	 */
	public BitSet getRingAtoms(){
		return (BitSet) _ringAtoms.get().clone();
	}

	public Optional<Edge> getEdgeBetweenNodes(int n1, int n2){
		return nodes.get(n1).getEdges()
				.stream()
				.filter(e->e.hasNode(n2))
				.findFirst();
	}

	public boolean isLaidOut(){
		return nodes.stream().allMatch(n->n.getPoint()!=null);
	}

	/**
	 * Bounding box of all placed node points, or empty if nothing has been placed.
	 */
	public Optional<Rectangle2D> getBounds(){
		Rectangle2D rect = null;
		for(Node n: nodes){
			Point2D p = n.getPoint();
			if(p==null)continue;
			if(rect==null){
				rect = new Rectangle2D.Double(p.getX(), p.getY(), 0, 0);
			}else{
				rect.add(p);
			}
		}
		return Optional.ofNullable(rect);
	}

	/**
	 * Moves every placed node by the given transform.
	 */
	public ConnectionTable applyTransform(AffineTransform at){
		for(Node n: nodes){
			if(n.point!=null){
				n.point = at.transform(n.point, null);
			}
		}
		return this;
	}

	public String toString(){
		return "ConnectionTable: " + nodes.size() + " nodes, " + edges.size() + " edges";
	}

	public class Node{
		private final int index;
		private String symbol="C";
		private boolean aromatic=false;
		private int charge=0;
		private int hydrogens=0;
		private int isotope=0;
		private Chirality chirality = Chirality.NONE;
		private Point2D point;
		private final List<Integer> edgeOffsets = new ArrayList<>();

		private Node(int index, String s){
			this.index=index;
			this.symbol=s;
		}

		public int getIndex(){
			return index;
		}

		public String getSymbol() {
			return this.symbol;
		}

		public boolean isAromatic(){
			return aromatic;
		}

		public Node setAromatic(boolean aromatic){
			this.aromatic=aromatic;
			return this;
		}

		public int getCharge(){
			return this.charge;
		}

		public Node setCharge(int c){
			this.charge=c;
			return this;
		}

		/**
		 * Hydrogen count given in a bracket atom, 0 if none was written.
		 */
		public int getExplicitHydrogens(){
			return hydrogens;
		}

		public Node setExplicitHydrogens(int h){
			this.hydrogens=h;
			return this;
		}

		public OptionalInt getIsotope(){
			if(isotope<=0){
				return OptionalInt.empty();
			}
			return OptionalInt.of(isotope);
		}

		public Node setIsotope(int mass){
			this.isotope=mass;
			return this;
		}

		public Chirality getChirality(){
			return chirality;
		}

		public Node setChirality(Chirality c){
			this.chirality=c;
			return this;
		}

		public Point2D getPoint() {
			return this.point;
		}

		/**
		 * Positions are written once; use {@link ConnectionTable#applyTransform(AffineTransform)}
		 * to move an already placed structure.
		 * @throws IllegalStateException if this node already has a position.
		 */
		public Node place(Point2D p){
			if(this.point!=null){
				throw new IllegalStateException("node " + index + " is already placed at " + point);
			}
			this.point=new Point2D.Double(p.getX(), p.getY());
			return this;
		}

		public List<Edge> getEdges(){
			return edgeOffsets.stream()
					.map(i->edges.get(i))
					.collect(Collectors.toList());
		}

		public int getEdgeCount() {
			return this.edgeOffsets.size();
		}

		/**
		 * Neighbor nodes in the order their bonds were added.
		 */
		public List<Node> getNeighborNodes(){
			return getEdges().stream()
					.map(e->e.getOtherNode(this))
					.collect(Collectors.toList());
		}

		public boolean connectsTo(Node v) {
			return getEdges().stream().anyMatch(e->e.hasNode(v.getIndex()));
		}

		public double getValenceTotal() {
			return getEdges().stream().mapToDouble(e->e.getOrder().getValue()).sum();
		}

		/**
		 * The explicit count when one was given; otherwise
		 * max(0, standard valence - sum of bond orders - |charge|).
		 */
		public int getImplicitHydrogens(){
			if(hydrogens>0){
				return hydrogens;
			}
			double free = getStandardValence(symbol) - getValenceTotal() - Math.abs(charge);
			return (int) Math.max(0, Math.floor(free));
		}

		public boolean isInRing(){
			return _ringAtoms.get().get(index);
		}

		public String toString(){
			return "Node: " + index + " " + (aromatic?symbol.toLowerCase():symbol) + ", charge=" + charge;
		}
	}

	public class Edge{
		private final int index;
		private final int n1;
		private final int n2;
		private BondOrder order;
		private BondStereo stereo = BondStereo.NONE;
		private boolean aromatic=false;

		private Edge(int index, int n1, int n2, BondOrder o){
			this.index=index;
			this.n1=n1;
			this.n2=n2;
			this.order=o;
		}

		public int getIndex(){
			return index;
		}

		public int getNode1Offset(){
			return n1;
		}

		public int getNode2Offset(){
			return n2;
		}

		public Node getRealNode1(){
			return nodes.get(n1);
		}

		public Node getRealNode2(){
			return nodes.get(n2);
		}

		public Node getOtherNode(Node n){
			if(n.getIndex() == this.n1)return getRealNode2();
			if(n.getIndex() == this.n2)return getRealNode1();
			return null;
		}

		public boolean hasNode(int offset) {
			return n1==offset || n2==offset;
		}

		public BondOrder getOrder() {
			return this.order;
		}

		public Edge setOrder(BondOrder order) {
			this.order = order;
			return this;
		}

		public BondStereo getStereo(){
			return stereo;
		}

		public Edge setStereo(BondStereo s){
			this.stereo=s;
			return this;
		}

		public boolean isAromatic() {
			return aromatic;
		}

		/**
		 * Marks the bond aromatic. Order becomes 1.5 only when both ends are
		 * aromatic atoms, otherwise the bond stays single and is just drawn dashed.
		 */
		public Edge setToAromatic(){
			this.aromatic=true;
			if(getRealNode1().isAromatic() && getRealNode2().isAromatic()){
				this.order=BondOrder.AROMATIC;
			}else{
				this.order=BondOrder.SINGLE;
			}
			return this;
		}

		public String toString(){
			return "Edge: " + this.n1 + " to " + this.n2 + ", order=" + this.order + ", stereo=" + this.stereo + ", aromatic=" + this.aromatic;
		}
	}
}
