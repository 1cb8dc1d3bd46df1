package gov.nih.ncats.molrender.internal.render;

import java.awt.geom.Line2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.text.NumberFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import gov.nih.ncats.molrender.MolRenderOptions;
import gov.nih.ncats.molrender.internal.util.ConnectionTable;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.BondOrder;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Edge;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Node;
import gov.nih.ncats.molrender.internal.util.GeomUtil;

/**
 * Writes a laid out {@link ConnectionTable} as an SVG document in skeletal
 * formula style.
 * <p>
 * All drawing happens in layout units inside a single
 * {@code translate(..) scale(..)} group, so bond widths, spacings and font
 * sizes from {@link MolRenderOptions} scale together with the structure.
 */
public class SvgRenderer{
	private static final Logger logger = Logger.getLogger(SvgRenderer.class.getName());

	private static final String SVG_NS = "http://www.w3.org/2000/svg";
	private static final String FONT_FAMILY = "Arial, sans-serif";

	private static final double WEDGE_WIDTH = 6;
	private static final double CHAR_WIDTH_RATIO = 0.6;
	private static final double CHARGE_FONT_RATIO = 0.8;

	private static final String AROMATIC_DASH = "3,2";
	private static final String STEREO_DASH = "4,4";

	private static ThreadLocal<NumberFormat> SVG_NUMBER_FORMAT = ThreadLocal.withInitial(()->{
		NumberFormat nf = NumberFormat.getNumberInstance(Locale.ENGLISH);
		nf.setMinimumIntegerDigits(1);
		nf.setMinimumFractionDigits(0);
		nf.setMaximumFractionDigits(2);
		nf.setGroupingUsed(false);
		return nf;
	});

	private final MolRenderOptions options;

	public SvgRenderer(MolRenderOptions options){
		this.options = Objects.requireNonNull(options);
	}

	/**
	 * Renders the given structure.
	 * @param ct the laid out structure; an empty table gives the placeholder.
	 * @return a complete SVG document.
	 * @throws IllegalStateException if an atom has no position.
	 */
	public String render(ConnectionTable ct){
		if(ct.isEmpty()){
			return placeholder();
		}
		if(!ct.isLaidOut()){
			throw new IllegalStateException("structure must be laid out before rendering");
		}

		Map<Integer,AtomLabel> labels = new LinkedHashMap<>();
		for(Node n : ct.getNodes()){
			label(n).ifPresent(l->labels.put(n.getIndex(), l));
		}

		Rectangle2D box = drawingBounds(ct, labels);
		double scale = Math.min(
				Math.max(options.getWidth() - 2*options.getPadding(), 1) / Math.max(box.getWidth(), 1),
				Math.max(options.getHeight() - 2*options.getPadding(), 1) / Math.max(box.getHeight(), 1));
		double tx = options.getWidth()/2.0 - box.getCenterX()*scale;
		double ty = options.getHeight()/2.0 - box.getCenterY()*scale;

		logger.fine(()->"rendering " + ct + " at scale " + fmt(scale));

		StringBuilder svg = new StringBuilder(256 + 160*(ct.getEdges().size() + labels.size()));
		openSvg(svg);
		svg.append("<g transform=\"translate(").append(fmt(tx)).append(',').append(fmt(ty))
			.append(") scale(").append(fmt(scale)).append(")\">\n");

		for(Edge e : ct.getEdges()){
			drawBond(svg, e, labels);
		}
		for(AtomLabel l : labels.values()){
			drawLabel(svg, l);
		}

		svg.append("</g>\n</svg>");
		return svg.toString();
	}

	/**
	 * Document shown when there is nothing to draw.
	 */
	public String placeholder(){
		return message("No structure", "gray");
	}

	/**
	 * Document that shows an error message in place of a structure.
	 */
	public String error(String message){
		return message("Error: " + (message==null?"unknown error":message), "red");
	}

	private String message(String text, String color){
		StringBuilder svg = new StringBuilder(300);
		openSvg(svg);
		svg.append("<text x=\"").append(fmt(options.getWidth()/2.0))
			.append("\" y=\"").append(fmt(options.getHeight()/2.0))
			.append("\" text-anchor=\"middle\" dominant-baseline=\"central\" font-size=\"").append(fmt(options.getFontSize()))
			.append("\" font-family=\"").append(FONT_FAMILY)
			.append("\" fill=\"").append(color).append("\">")
			.append(escapeXml(text))
			.append("</text>\n</svg>");
		return svg.toString();
	}

	private void openSvg(StringBuilder svg){
		svg.append("<svg xmlns=\"").append(SVG_NS)
			.append("\" width=\"").append(options.getWidth())
			.append("\" height=\"").append(options.getHeight())
			.append("\" viewBox=\"0 0 ").append(options.getWidth()).append(' ').append(options.getHeight())
			.append("\">\n");
	}

	Optional<AtomLabel> label(Node n){
		String sym = n.getSymbol();
		boolean carbon = "C".equals(sym);
		if(carbon && n.getCharge()==0 && !options.isShowCarbons()){
			return Optional.empty();
		}
		StringBuilder text = new StringBuilder();
		n.getIsotope().ifPresent(text::append);
		text.append(sym);

		boolean withHydrogens = !"H".equals(sym) && (!carbon || options.isShowImplicitHydrogens());
		if(withHydrogens){
			int h = n.getImplicitHydrogens();
			if(h>0){
				text.append('H');
				if(h>1){
					text.append(h);
				}
			}
		}
		return Optional.of(new AtomLabel(n.getPoint(), text.toString(), chargeText(n.getCharge())));
	}

	static String chargeText(int charge){
		if(charge==0){
			return null;
		}
		int abs = Math.abs(charge);
		String sign = charge>0?"+":"-";
		return abs==1?sign:abs + sign;
	}

	private Rectangle2D drawingBounds(ConnectionTable ct, Map<Integer,AtomLabel> labels){
		Rectangle2D box = ct.getBounds().get();
		for(AtomLabel l : labels.values()){
			box.add(l.getBounds(options.getFontSize()));
		}
		return box;
	}

	private void drawBond(StringBuilder svg, Edge e, Map<Integer,AtomLabel> labels){
		double margin = options.getBondMargin();
		Line2D line = GeomUtil.shorten(
				new Line2D.Double(e.getRealNode1().getPoint(), e.getRealNode2().getPoint()),
				labels.containsKey(e.getNode1Offset())?margin:0,
				labels.containsKey(e.getNode2Offset())?margin:0);

		if(e.isAromatic() || e.getOrder()==BondOrder.AROMATIC){
			line(svg, line, AROMATIC_DASH);
			return;
		}
		double spacing = options.getDoubleBondSpacing();
		switch(e.getOrder()){
			case DOUBLE:
				line(svg, GeomUtil.offset(line, spacing/2), null);
				line(svg, GeomUtil.offset(line, -spacing/2), null);
				break;
			case TRIPLE:
				line(svg, line, null);
				line(svg, GeomUtil.offset(line, spacing), null);
				line(svg, GeomUtil.offset(line, -spacing), null);
				break;
			default:
				switch(e.getStereo()){
					case UP:
						wedge(svg, line);
						break;
					case DOWN:
						line(svg, line, STEREO_DASH);
						break;
					default:
						line(svg, line, null);
						break;
				}
				break;
		}
	}

	private void line(StringBuilder svg, Line2D l, String dash){
		svg.append("<line x1=\"").append(fmt(l.getX1()))
			.append("\" y1=\"").append(fmt(l.getY1()))
			.append("\" x2=\"").append(fmt(l.getX2()))
			.append("\" y2=\"").append(fmt(l.getY2()))
			.append("\" stroke=\"black\" stroke-width=\"").append(fmt(options.getBondWidth())).append('"');
		if(dash!=null){
			svg.append(" stroke-dasharray=\"").append(dash).append('"');
		}
		svg.append("/>\n");
	}

	private void wedge(StringBuilder svg, Line2D l){
		Point2D a = GeomUtil.offset(l, WEDGE_WIDTH/2).getP2();
		Point2D b = GeomUtil.offset(l, -WEDGE_WIDTH/2).getP2();
		svg.append("<polygon points=\"")
			.append(fmt(l.getX1())).append(',').append(fmt(l.getY1())).append(' ')
			.append(fmt(a.getX())).append(',').append(fmt(a.getY())).append(' ')
			.append(fmt(b.getX())).append(',').append(fmt(b.getY()))
			.append("\" fill=\"black\"/>\n");
	}

	private void drawLabel(StringBuilder svg, AtomLabel l){
		double fontSize = options.getFontSize();
		Point2D p = l.getPoint();
		svg.append("<text x=\"").append(fmt(p.getX()))
			.append("\" y=\"").append(fmt(p.getY()))
			.append("\" text-anchor=\"middle\" dominant-baseline=\"central\" font-size=\"").append(fmt(fontSize))
			.append("\" font-family=\"").append(FONT_FAMILY)
			.append("\" fill=\"black\">")
			.append(escapeXml(l.getText()))
			.append("</text>\n");

		if(l.getCharge()!=null){
			Point2D c = l.getChargeAnchor(fontSize);
			svg.append("<text x=\"").append(fmt(c.getX()))
				.append("\" y=\"").append(fmt(c.getY()))
				.append("\" text-anchor=\"start\" font-size=\"").append(fmt(fontSize*CHARGE_FONT_RATIO))
				.append("\" font-family=\"").append(FONT_FAMILY)
				.append("\" fill=\"black\">")
				.append(escapeXml(l.getCharge()))
				.append("</text>\n");
		}
	}

	/**
	 * Locale independent, at most two decimals, and never "-0".
	 */
	static String fmt(double d){
		if(Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d)<0.005){
			return "0";
		}
		return SVG_NUMBER_FORMAT.get().format(d);
	}

	public static String escapeXml(String s){
		StringBuilder sb = new StringBuilder(s.length());
		for(int i=0;i<s.length();i++){
			char c = s.charAt(i);
			switch(c){
				case '&': sb.append("&amp;"); break;
				case '<': sb.append("&lt;"); break;
				case '>': sb.append("&gt;"); break;
				case '"': sb.append("&quot;"); break;
				case '\'': sb.append("&apos;"); break;
				default: sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Text drawn on an atom, plus the estimated box it covers.
	 */
	static class AtomLabel{
		private final Point2D point;
		private final String text;
		private final String charge;

		AtomLabel(Point2D point, String text, String charge){
			this.point=point;
			this.text=text;
			this.charge=charge;
		}

		public Point2D getPoint(){
			return point;
		}

		public String getText(){
			return text;
		}

		public String getCharge(){
			return charge;
		}

		Point2D getChargeAnchor(double fontSize){
			return new Point2D.Double(point.getX() + halfWidth(fontSize), point.getY() - fontSize*0.55);
		}

		private double halfWidth(double fontSize){
			return text.length()*fontSize*CHAR_WIDTH_RATIO/2;
		}

		Rectangle2D getBounds(double fontSize){
			double hw = halfWidth(fontSize);
			Rectangle2D r = new Rectangle2D.Double(point.getX()-hw, point.getY()-fontSize/2, 2*hw, fontSize);
			if(charge!=null){
				Point2D c = getChargeAnchor(fontSize);
				double cs = fontSize*CHARGE_FONT_RATIO;
				r.add(new Rectangle2D.Double(c.getX(), c.getY()-cs/2, charge.length()*cs*CHAR_WIDTH_RATIO, cs));
			}
			return r;
		}
	}
}
