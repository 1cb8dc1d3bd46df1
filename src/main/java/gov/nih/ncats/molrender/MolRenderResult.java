package gov.nih.ncats.molrender;

import java.awt.geom.Rectangle2D;
import java.util.List;
import java.util.Optional;

/**
 * Object to hold the information of a single notation to diagram result.
 */
public interface MolRenderResult {
    /**
     * The rendered document. Always a complete SVG document, even when
     * {@link #hasError()} is true, in which case it shows the error message.
     * @return the SVG as a String; never null.
     */
    String getSvg();

    /**
     * Everything the parser skipped while reading the notation.
     * @return a possibly empty, unmodifiable list in input order.
     */
    List<ParseDiagnostic> getDiagnostics();

    /**
     * Bounding box of the atom positions after layout and re-centering,
     * in layout units (one bond is 30 units).
     * @return an Optional containing a Rectangle2D or an empty optional if
     * nothing was laid out or there was an error.
     */
    Optional<Rectangle2D> getLayoutBounds();

    /**
     * If there was an error during computing the result.
     * @return
     */
    boolean hasError();

    /**
     * Return the Throwable error if there is one; or empty optional if there is no error.
     * @return
     *
     * @see #hasError()
     */
    Optional<Throwable> getError();

    /**
     * Factory method to create a MolRenderResult that has the given error.
     * @param t the error, can not be null.
     * @param options the options to size the error document with; if null the defaults are used.
     * @return
     */
    static MolRenderResult createFromError(Throwable t, MolRenderOptions options){
        return new ErrorResult(t, options);
    }
}
