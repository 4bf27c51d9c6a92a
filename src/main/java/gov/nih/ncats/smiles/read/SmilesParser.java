package gov.nih.ncats.smiles.read;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

import gov.nih.ncats.smiles.IncompatibleBondException;
import gov.nih.ncats.smiles.SmilesException;
import gov.nih.ncats.smiles.SmilesSyntaxException;
import gov.nih.ncats.smiles.SmilesSyntaxException.Reason;
import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.feature.Configuration;
import gov.nih.ncats.smiles.feature.Element;
import gov.nih.ncats.smiles.tree.BranchNode;
import gov.nih.ncats.smiles.tree.RingBond;

/**
 * Recursive descent SMILES reader.
 * <pre>
 * smiles  := chain ('.' chain)*
 * chain   := atom (bond? ring-bond | bond? atom | branch)*
 * branch  := '(' bond? atom (bond? ring-bond | bond? atom | branch)* ')'
 * atom    := '*' | organic | aromatic | '[' isotope? symbol configuration? hcount? charge? (':' map)? ']'
 * </pre>
 * Chains are read in a loop; only branches recurse. Ring bond numbers are
 * matched as they are read, and the first error stops the parse.
 */
public final class SmilesParser {

	private static final Logger logger = Logger.getLogger(SmilesParser.class.getName());

	private static final String[] CHIRAL_CLASSES = {"TH","AL","SP","TB","OH"};

	private SmilesParser(){
		//can not instantiate
	}

	public static Reading parse(String text) throws SmilesException{
		return parse(text, null);
	}

	/**
	 * @param text the SMILES to read.
	 * @param trace an unused trace to fill in, or null to skip tracing.
	 * @throws SmilesSyntaxException if the text is not SMILES.
	 * @throws IncompatibleBondException if the two ends of a ring bond
	 * disagree about its kind.
	 * @throws IllegalStateException if the trace was used before.
	 */
	public static Reading parse(String text, Trace trace) throws SmilesException{
		Objects.requireNonNull(text);
		if(trace!=null){
			trace.start();
		}
		Context ctx = new Context(text, trace);
		try{
			List<BranchNode> roots = new ArrayList<>();
			roots.add(ctx.chain());
			while(true){
				Terminal t = ctx.scanner.peekTerminal();
				if(t==Terminal.END){
					break;
				}
				if(t!=Terminal.DOT){
					throw ctx.scanner.invalid();
				}
				ctx.scanner.next();
				roots.add(ctx.chain());
			}
			Optional<RingBond> unclosed = ctx.open.values().stream()
					.min(Comparator.comparingInt(RingBond::getOpenCursor));
			if(unclosed.isPresent()){
				throw new SmilesSyntaxException(Reason.UNBALANCED_RING_BOND, unclosed.get().getOpenCursor());
			}
			if(trace!=null){
				trace.complete();
			}
			return new Reading(text, roots, ctx.closed, ctx.atomCount, trace);
		}catch(SmilesException e){
			logger.fine("could not read \"" + text + "\": " + e.getMessage());
			throw e;
		}
	}

	/**
	 * State of one parse.
	 */
	private static final class Context{
		private final Scanner scanner;
		private final Trace trace;
		private final Map<Integer,RingBond> open = new HashMap<>();
		private final Map<Integer,Integer> openBondIds = new HashMap<>();
		private final List<RingBond> closed = new ArrayList<>();
		private int atomCount;

		Context(String text, Trace trace){
			this.scanner=new Scanner(text);
			this.trace=trace;
		}

		BranchNode chain() throws SmilesException{
			BranchNode root = atom();
			tail(root, atomCount-1);
			return root;
		}

		/**
		 * Read everything bonded after the given atom until something that
		 * does not continue the chain.
		 */
		void tail(BranchNode current, int currentId) throws SmilesException{
			while(true){
				switch(scanner.peekTerminal()){
				case BOND:{
					int bondCursor = scanner.getCursor();
					BondKind kind = scanner.readBond();
					Terminal t = scanner.peekTerminal();
					if(t==Terminal.RING_BOND){
						ringBond(current, currentId, kind, bondCursor);
					}else if(t==Terminal.ATOM || t==Terminal.BRACKET_OPEN){
						BranchNode child = atom();
						int childId = atomCount-1;
						chainBond(current, currentId, kind, child, childId, bondCursor);
						current = child;
						currentId = childId;
					}else{
						throw scanner.invalid();
					}
					break;
				}
				case RING_BOND:
					ringBond(current, currentId, BondKind.ELIDED, -1);
					break;
				case ATOM:
				case BRACKET_OPEN:{
					int atomCursor = scanner.getCursor();
					BranchNode child = atom();
					int childId = atomCount-1;
					chainBond(current, currentId, BondKind.ELIDED, child, childId, atomCursor);
					current = child;
					currentId = childId;
					break;
				}
				case BRANCH_OPEN:
					branch(current, currentId);
					break;
				default:
					return;
				}
			}
		}

		void branch(BranchNode parent, int parentId) throws SmilesException{
			scanner.next();
			BondKind kind = BondKind.ELIDED;
			int bondCursor = scanner.getCursor();
			if(scanner.peekTerminal()==Terminal.BOND){
				kind = scanner.readBond();
			}
			Terminal t = scanner.peekTerminal();
			if(t!=Terminal.ATOM && t!=Terminal.BRACKET_OPEN){
				throw scanner.invalid();
			}
			BranchNode child = atom();
			int childId = atomCount-1;
			chainBond(parent, parentId, kind, child, childId, bondCursor);
			tail(child, childId);
			if(!scanner.consume(')')){
				throw scanner.invalid();
			}
		}

		void chainBond(BranchNode parent, int parentId, BondKind kind, BranchNode child, int childId, int cursor){
			parent.addChild(kind, child);
			if(trace!=null){
				int id = trace.addBond(cursor);
				trace.mapBond(parentId, childId, id);
				trace.mapBond(childId, parentId, id);
			}
		}

		void ringBond(BranchNode node, int id, BondKind kind, int bondCursor) throws SmilesException{
			int cursor = scanner.getCursor();
			int number = scanner.readRingNumber();
			if(trace!=null){
				trace.addRnum(CursorRange.of(cursor, scanner.getCursor()));
			}
			int traceCursor = bondCursor<0?cursor:bondCursor;
			RingBond rb = open.get(number);
			if(rb==null){
				rb = new RingBond(number, id, kind, cursor);
				open.put(number, rb);
				node.addRingBond(rb);
				if(trace!=null){
					openBondIds.put(number, trace.addBond(traceCursor));
				}
				return;
			}
			if(rb.getOpenId()==id){
				throw new SmilesSyntaxException(Reason.DUPLICATE_RING_BOND, cursor);
			}
			if(!rb.close(id, kind, cursor)){
				throw new IncompatibleBondException(cursor, rb.getOpenId(), id);
			}
			open.remove(number);
			closed.add(rb);
			node.addRingBond(rb);
			if(trace!=null){
				int closeBondId = trace.addBond(traceCursor);
				trace.mapBond(rb.getOpenId(), id, openBondIds.remove(number));
				trace.mapBond(id, rb.getOpenId(), closeBondId);
			}
		}

		BranchNode atom() throws SmilesException{
			int start = scanner.getCursor();
			AtomKind kind;
			if(scanner.peekTerminal()==Terminal.BRACKET_OPEN){
				kind = bracketAtom();
			}else{
				kind = scanner.readUnbracketedAtom();
			}
			atomCount++;
			if(trace!=null){
				trace.addAtom(CursorRange.of(start, scanner.getCursor()));
			}
			return new BranchNode(kind);
		}

		AtomKind bracketAtom() throws SmilesException{
			scanner.next();
			OptionalInt isotope = scanner.readNumber(3);
			AtomKind.BracketBuilder builder = symbol();
			isotope.ifPresent(builder::isotope);

			if(scanner.peek()=='@'){
				builder.configuration(configuration());
			}
			if(scanner.consume('H')){
				builder.hcount(scanner.readNumber(1).orElse(1));
			}
			int sign = scanner.peek();
			if(sign=='+' || sign=='-'){
				scanner.next();
				int numberCursor = scanner.getCursor();
				int charge;
				OptionalInt n = scanner.readNumber(2);
				if(n.isPresent()){
					if(n.getAsInt()>15){
						throw scanner.invalidAt(numberCursor);
					}
					charge = n.getAsInt();
				}else if(scanner.consume((char)sign)){
					charge = 2;
				}else{
					charge = 1;
				}
				builder.charge(sign=='-'?-charge:charge);
			}
			if(scanner.consume(':')){
				builder.map(scanner.readNumber(3).orElseThrow(scanner::invalid));
			}
			if(!scanner.consume(']')){
				throw scanner.invalid();
			}
			return builder.build();
		}

		private AtomKind.BracketBuilder symbol() throws SmilesSyntaxException{
			int c = scanner.peek();
			if(c<0){
				throw scanner.endOfInput();
			}
			if(c=='*'){
				scanner.next();
				return AtomKind.bracketStar();
			}
			if(c>='a' && c<='z'){
				int c2 = scanner.peek(1);
				if(c2>='a' && c2<='z'){
					Optional<Element> two = Element.fromSymbol(new String(new char[]{(char)Character.toUpperCase(c),(char)c2}))
							.filter(Element::isBracketAromatic);
					if(two.isPresent()){
						scanner.next();
						scanner.next();
						return AtomKind.bracket(two.get()).aromatic(true);
					}
				}
				Optional<Element> one = Element.fromSymbol(String.valueOf((char)Character.toUpperCase(c)))
						.filter(Element::isBracketAromatic);
				if(!one.isPresent()){
					throw scanner.invalid();
				}
				scanner.next();
				return AtomKind.bracket(one.get()).aromatic(true);
			}
			if(c>='A' && c<='Z'){
				int c2 = scanner.peek(1);
				if(c2>='a' && c2<='z'){
					Optional<Element> two = Element.fromSymbol(new String(new char[]{(char)c,(char)c2}));
					if(two.isPresent()){
						scanner.next();
						scanner.next();
						return AtomKind.bracket(two.get());
					}
				}
				Optional<Element> one = Element.fromSymbol(String.valueOf((char)c));
				if(one.isPresent()){
					scanner.next();
					return AtomKind.bracket(one.get());
				}
			}
			throw scanner.invalid();
		}

		private Configuration configuration() throws SmilesSyntaxException{
			scanner.next();
			if(scanner.consume('@')){
				return Configuration.TH2;
			}
			int classCursor = scanner.getCursor();
			for(String chiralClass : CHIRAL_CLASSES){
				if(scanner.peek()==chiralClass.charAt(0) && scanner.peek(1)==chiralClass.charAt(1)){
					scanner.next();
					scanner.next();
					int n = scanner.readNumber(2).orElseThrow(scanner::invalid);
					return Configuration.of(chiralClass, n)
							.orElseThrow(()->scanner.invalidAt(classCursor));
				}
			}
			return Configuration.TH1;
		}
	}
}
