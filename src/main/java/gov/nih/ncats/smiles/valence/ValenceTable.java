package gov.nih.ncats.smiles.valence;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import gov.nih.ncats.smiles.feature.Element;
import gov.nih.ncats.smiles.internal.util.CachedSupplier;

/**
 * Permitted normal valences per element and charge, read once from the
 * {@code valence.properties} resource next to this class.
 */
public final class ValenceTable {

	private static final Logger logger = Logger.getLogger(ValenceTable.class.getName());

	private static final String RESOURCE = "valence.properties";

	private static final Pattern KEY = Pattern.compile("([A-Z][a-z]?)([+-]\\d+)?");

	private static final Supplier<ValenceTable> DEFAULT = CachedSupplier.of(()->{
		try(InputStream in = ValenceTable.class.getResourceAsStream(RESOURCE)){
			if(in==null){
				throw new IllegalStateException("missing resource " + RESOURCE);
			}
			return load(new InputStreamReader(in, StandardCharsets.UTF_8));
		}catch(IOException e){
			throw new UncheckedIOException("could not read " + RESOURCE, e);
		}
	});

	private final Map<Element, Map<Integer,int[]>> table;

	private ValenceTable(Map<Element, Map<Integer,int[]>> table){
		this.table=table;
	}

	/**
	 * The table shipped with this library.
	 */
	public static ValenceTable getDefault(){
		return DEFAULT.get();
	}

	/**
	 * Parse a table from properties text. Entries that can not be parsed
	 * are logged and skipped.
	 */
	public static ValenceTable load(Reader reader) throws IOException{
		Properties props = new Properties();
		props.load(reader);

		Map<Element, Map<Integer,int[]>> table = new HashMap<>();
		for(String key : props.stringPropertyNames()){
			String value = props.getProperty(key);
			Matcher m = KEY.matcher(key.trim());
			Optional<Element> element = m.matches()? Element.fromSymbol(m.group(1)) : Optional.empty();
			if(!element.isPresent()){
				logger.warning("skipping valence entry with unknown key " + key);
				continue;
			}
			int charge = m.group(2)==null?0:Integer.parseInt(m.group(2).replace("+", ""));
			int[] valences;
			try{
				valences = parseValences(value);
			}catch(NumberFormatException e){
				logger.log(Level.WARNING, "skipping valence entry " + key + "=" + value, e);
				continue;
			}
			table.computeIfAbsent(element.get(), k->new HashMap<>()).put(charge, valences);
		}
		logger.config("loaded valences for " + table.size() + " elements");
		return new ValenceTable(Collections.unmodifiableMap(table));
	}

	private static int[] parseValences(String value){
		int[] v = Arrays.stream(value.split(","))
				.map(String::trim)
				.mapToInt(Integer::parseInt)
				.sorted()
				.toArray();
		if(v.length==0 || v[0]<0){
			throw new NumberFormatException("valences must be non-negative: " + value);
		}
		return v;
	}

	/**
	 * The permitted valences of an element at a given charge, ascending.
	 * @return empty if the table has no entry for that element and charge.
	 */
	public Optional<int[]> getValences(Element element, int charge){
		Map<Integer,int[]> byCharge = table.get(element);
		if(byCharge==null){
			return Optional.empty();
		}
		int[] v = byCharge.get(charge);
		return v==null?Optional.empty():Optional.of(v.clone());
	}

	public boolean contains(Element element){
		return table.containsKey(element);
	}
}
