package gov.nih.ncats.smiles;

import java.util.Objects;
import java.util.OptionalInt;

import gov.nih.ncats.smiles.graph.ConnectionTable;
import gov.nih.ncats.smiles.graph.GraphBuilder;
import gov.nih.ncats.smiles.read.Reading;
import gov.nih.ncats.smiles.read.SmilesParser;
import gov.nih.ncats.smiles.read.Trace;
import gov.nih.ncats.smiles.valence.ImplicitHydrogens;
import gov.nih.ncats.smiles.write.SmilesWriter;

/**
 * Entry point for reading and writing SMILES.
 * <pre>
 * Trace trace = new Trace();
 * ConnectionTable ct = Smiles.toGraph(Smiles.read("OC[CH3]", trace));
 * OptionalInt h = Smiles.implicitHydrogens(ct, 1); // 2
 * String smi = Smiles.write(ct);
 * </pre>
 */
public final class Smiles {

	private static final SmilesWriterOptions DEFAULT_OPTIONS = new SmilesWriterOptions();

	private Smiles(){
		//can not instantiate
	}

	/**
	 * Read SMILES text into its parse trees.
	 * @param smiles the text to read, can not be null.
	 * @return the {@link Reading}, with one root per component.
	 * @throws SmilesSyntaxException if the text is not SMILES; the
	 * exception gives the offset of the problem.
	 * @throws IncompatibleBondException if a ring bond is written with
	 * conflicting kinds at its two ends.
	 * @throws NullPointerException if smiles is null.
	 */
	public static Reading read(String smiles) throws SmilesException{
		return SmilesParser.parse(smiles, null);
	}

	/**
	 * Read SMILES text, recording where every atom, bond and ring bond
	 * number came from in the given trace.
	 *
	 * @param smiles the text to read, can not be null.
	 * @param trace a new {@link Trace}; if null, nothing is traced.
	 *
	 * @throws SmilesException if the text can not be read.
	 * @throws IllegalStateException if trace was already used.
	 */
	public static Reading read(String smiles, Trace trace) throws SmilesException{
		return SmilesParser.parse(smiles, trace);
	}

	/**
	 * Flatten a reading into a graph whose atom ids are the reading order.
	 * The reading's trace, if any, is attached to the graph.
	 */
	public static ConnectionTable toGraph(Reading reading) throws IncompatibleBondException{
		Objects.requireNonNull(reading);
		return GraphBuilder.fromTree(reading.getRoots(), reading.getTrace().orElse(null));
	}

	/**
	 * Read SMILES text straight into a graph.
	 */
	public static ConnectionTable parse(String smiles) throws SmilesException{
		return toGraph(read(smiles));
	}

	/**
	 * @return the implicit hydrogen count of an atom, or empty if it does
	 * not apply to that atom.
	 * @throws HypervalentAtomException if the atom has more bonds than its element allows.
	 */
	public static OptionalInt implicitHydrogens(ConnectionTable ct, int atomId) throws HypervalentAtomException{
		return ImplicitHydrogens.of(ct, atomId);
	}

	/**
	 * Write a graph as SMILES starting from atom 0.
	 */
	public static String write(ConnectionTable ct){
		return write(ct, DEFAULT_OPTIONS);
	}

	public static String write(ConnectionTable ct, int startAtom){
		return write(ct, new SmilesWriterOptions().startAtom(startAtom));
	}

	/**
	 * @param options the {@link SmilesWriterOptions} to use; if options is null, then the default options are used.
	 * @throws IllegalArgumentException if the graph is malformed or the start atom is not in it.
	 */
	public static String write(ConnectionTable ct, SmilesWriterOptions options){
		return new SmilesWriter(ct, options).write().getText();
	}
}
