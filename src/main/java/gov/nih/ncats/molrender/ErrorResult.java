package gov.nih.ncats.molrender;

import java.awt.geom.Rectangle2D;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import gov.nih.ncats.molrender.internal.render.SvgRenderer;

class ErrorResult implements MolRenderResult{

    private final Throwable t;
    private final String svg;

    public ErrorResult(Throwable t, MolRenderOptions options) {
        this.t = Objects.requireNonNull(t);
        MolRenderOptions opts = options==null? new MolRenderOptions() : options;
        String message = t.getMessage()==null? t.getClass().getSimpleName() : t.getMessage();
        this.svg = new SvgRenderer(opts).error(message);
    }

    @Override
    public String getSvg() {
        return svg;
    }

    @Override
    public List<ParseDiagnostic> getDiagnostics() {
        return Collections.emptyList();
    }

    @Override
    public Optional<Rectangle2D> getLayoutBounds() {
        return Optional.empty();
    }

    @Override
    public boolean hasError() {
        return true;
    }

    @Override
    public Optional<Throwable> getError() {
        return Optional.of(t);
    }
}
