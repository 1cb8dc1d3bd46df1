package gov.nih.ncats.molrender;

import java.awt.geom.Rectangle2D;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import gov.nih.ncats.molrender.internal.render.SvgRenderer;
import gov.nih.ncats.molrender.internal.util.CachedSupplier;
import gov.nih.ncats.molrender.internal.util.ConnectionTable;

/**
 * Drawing options for {@link MolRender}. All sizes are in layout units, where
 * one bond is 30 units long; the whole drawing is then scaled to fit
 * {@link #getWidth()} x {@link #getHeight()} pixels.
 */
public class MolRenderOptions {
	private static final Logger logger = Logger.getLogger(MolRenderOptions.class.getName());

    private int width = 400;
    private int height = 400;
    private double bondWidth = 2;
    private double doubleBondSpacing = 4;
    private double fontSize = 14;
    private boolean showCarbons = false;
    private boolean showImplicitHydrogens = false;
    private double padding = 20;
    private double bondMargin = 6;

    /**
     * Build options from a record of field names to values, as they come
     * from a JSON object or a properties file. Numbers, booleans and their
     * String forms are accepted; unknown keys are logged and ignored.
     *
     * @param map the fields to set, may be null.
     * @return a new options object, defaults for anything not in the map.
     * @throws IllegalArgumentException if a value is out of range or can not be converted.
     */
    public static MolRenderOptions fromMap(Map<String, ?> map){
        MolRenderOptions opts = new MolRenderOptions();
        if(map==null){
            return opts;
        }
        map.forEach((k,v)->{
            if(v==null){
                return;
            }
            switch(k){
                case "width": opts.width(toNumber(k, v).intValue()); break;
                case "height": opts.height(toNumber(k, v).intValue()); break;
                case "bondWidth": opts.bondWidth(toNumber(k, v).doubleValue()); break;
                case "doubleBondSpacing": opts.doubleBondSpacing(toNumber(k, v).doubleValue()); break;
                case "fontSize": opts.fontSize(toNumber(k, v).doubleValue()); break;
                case "showCarbons": opts.showCarbons(toBoolean(v)); break;
                case "showImplicitHydrogens": opts.showImplicitHydrogens(toBoolean(v)); break;
                case "padding": opts.padding(toNumber(k, v).doubleValue()); break;
                case "bondMargin": opts.bondMargin(toNumber(k, v).doubleValue()); break;
                default:
                    logger.warning("ignoring unknown render option '" + k + "'");
            }
        });
        return opts;
    }

    private static Number toNumber(String key, Object v){
        if(v instanceof Number){
            return (Number) v;
        }
        try{
            return Double.parseDouble(v.toString().trim());
        }catch(NumberFormatException e){
            throw new IllegalArgumentException(key + " must be a number but was '" + v + "'", e);
        }
    }

    private static boolean toBoolean(Object v){
        if(v instanceof Boolean){
            return (Boolean) v;
        }
        return Boolean.parseBoolean(v.toString().trim());
    }

    public int getWidth() {
        return width;
    }

    public MolRenderOptions width(int width){
        if(width <=0){
            throw new IllegalArgumentException("width must be > 0");
        }
        this.width = width;
        return this;
    }

    public int getHeight() {
        return height;
    }

    public MolRenderOptions height(int height){
        if(height <=0){
            throw new IllegalArgumentException("height must be > 0");
        }
        this.height = height;
        return this;
    }

    public double getBondWidth() {
        return bondWidth;
    }

    public MolRenderOptions bondWidth(double bondWidth){
        if(bondWidth <=0){
            throw new IllegalArgumentException("bond width must be > 0");
        }
        this.bondWidth = bondWidth;
        return this;
    }

    public double getDoubleBondSpacing() {
        return doubleBondSpacing;
    }

    public MolRenderOptions doubleBondSpacing(double doubleBondSpacing){
        if(doubleBondSpacing <0){
            throw new IllegalArgumentException("double bond spacing must be >= 0");
        }
        this.doubleBondSpacing = doubleBondSpacing;
        return this;
    }

    public double getFontSize() {
        return fontSize;
    }

    public MolRenderOptions fontSize(double fontSize){
        if(fontSize <=0){
            throw new IllegalArgumentException("font size must be > 0");
        }
        this.fontSize = fontSize;
        return this;
    }

    public boolean isShowCarbons() {
        return showCarbons;
    }

    /**
     * Label every carbon, not only charged ones.
     */
    public MolRenderOptions showCarbons(boolean showCarbons){
        this.showCarbons = showCarbons;
        return this;
    }

    public boolean isShowImplicitHydrogens() {
        return showImplicitHydrogens;
    }

    /**
     * Add the hydrogen count to labeled carbons as well (CH3, CH2 ...).
     * Heteroatoms always carry it.
     */
    public MolRenderOptions showImplicitHydrogens(boolean showImplicitHydrogens){
        this.showImplicitHydrogens = showImplicitHydrogens;
        return this;
    }

    public double getPadding() {
        return padding;
    }

    public MolRenderOptions padding(double padding){
        if(padding <0){
            throw new IllegalArgumentException("padding must be >= 0");
        }
        this.padding = padding;
        return this;
    }

    public double getBondMargin() {
        return bondMargin;
    }

    public MolRenderOptions bondMargin(double bondMargin){
        if(bondMargin <0){
            throw new IllegalArgumentException("bond margin must be >= 0");
        }
        this.bondMargin = bondMargin;
        return this;
    }

    public MolRenderResult computeResult(ConnectionTable ct, List<ParseDiagnostic> diagnostics){
        String svg = new SvgRenderer(this).render(ct);
        return new Result(svg, diagnostics, CachedSupplier.of(()-> ct.getBounds()));
    }

    @Override
    public String toString() {
        return "MolRenderOptions{" +
                "width=" + width +
                ", height=" + height +
                ", bondWidth=" + bondWidth +
                ", doubleBondSpacing=" + doubleBondSpacing +
                ", fontSize=" + fontSize +
                ", showCarbons=" + showCarbons +
                ", showImplicitHydrogens=" + showImplicitHydrogens +
                ", padding=" + padding +
                ", bondMargin=" + bondMargin +
                '}';
    }

    private static class Result implements MolRenderResult{
        private final String svg;
        private final List<ParseDiagnostic> diagnostics;
        private final CachedSupplier<Optional<Rectangle2D>> boundsSupplier;

        public Result(String svg, List<ParseDiagnostic> diagnostics, CachedSupplier<Optional<Rectangle2D>> boundsSupplier) {
            this.svg = svg;
            this.diagnostics = diagnostics==null?Collections.emptyList():Collections.unmodifiableList(diagnostics);
            this.boundsSupplier = boundsSupplier;
        }

        @Override
        public String getSvg() {
            return svg;
        }

        @Override
        public List<ParseDiagnostic> getDiagnostics() {
            return diagnostics;
        }

        @Override
        public Optional<Rectangle2D> getLayoutBounds() {
            return boundsSupplier.get();
        }

        @Override
        public boolean hasError() {
            return false;
        }

        @Override
        public Optional<Throwable> getError() {
            return Optional.empty();
        }
    }
}
