package info.isaksson.erland.modelimport.framework;

import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.report.ImportReport;

import java.util.List;

/**
 * One input dialect: a cheap sniffer plus a parser producing unnormalized IR.
 *
 * <p>{@link #sniff} must never throw and must not look beyond the context prefix.
 * {@link #parse} throws {@link StructuralParseException} only for structural preconditions;
 * everything else becomes a report warning.</p>
 */
public interface Importer {

    String id();

    /** Format id written to {@code meta.format}. */
    String format();

    String displayName();

    /** Higher is tried first. */
    int priority();

    List<String> extensions();

    boolean sniff(ImportContext ctx);

    IrModel parse(ImportSource source, ImportContext ctx, ImportReport report);
}
