package gov.nih.ncats.smiles.read;

import java.util.Objects;
import java.util.OptionalInt;

import gov.nih.ncats.smiles.SmilesSyntaxException;
import gov.nih.ncats.smiles.SmilesSyntaxException.Reason;
import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.feature.Element;

/**
 * Cursor over SMILES text that classifies what comes next and reads the
 * small tokens the grammar is built from. Every failure reports the
 * offset it happened at.
 */
public class Scanner {

	private final String text;
	private int cursor;

	public Scanner(String text){
		this.text=Objects.requireNonNull(text);
	}

	public String getText() {
		return text;
	}

	public int getCursor() {
		return cursor;
	}

	public boolean isDone(){
		return cursor>=text.length();
	}

	/**
	 * @return the next character, or -1 at the end.
	 */
	public int peek(){
		return peek(0);
	}

	public int peek(int ahead){
		int i = cursor+ahead;
		return i<text.length()?text.charAt(i):-1;
	}

	/**
	 * Consume one character.
	 * @throws SmilesSyntaxException at the end of the text.
	 */
	public int next() throws SmilesSyntaxException{
		if(isDone()){
			throw endOfInput();
		}
		return text.charAt(cursor++);
	}

	/**
	 * Consume the next character if it is c.
	 */
	public boolean consume(char c){
		if(peek()==c){
			cursor++;
			return true;
		}
		return false;
	}

	public Terminal peekTerminal(){
		int c = peek();
		switch(c){
		case -1:
			return Terminal.END;
		case '[':
			return Terminal.BRACKET_OPEN;
		case '(':
			return Terminal.BRANCH_OPEN;
		case ')':
			return Terminal.BRANCH_CLOSE;
		case '.':
			return Terminal.DOT;
		case '%':
			return Terminal.RING_BOND;
		case '*':
			return Terminal.ATOM;
		default:
			if(c>='0' && c<='9'){
				return Terminal.RING_BOND;
			}
			if(BondKind.fromSymbol(c).isPresent()){
				return Terminal.BOND;
			}
			if(organicLength()>0 || aromaticElement(c)!=null){
				return Terminal.ATOM;
			}
			return Terminal.INVALID;
		}
	}

	/**
	 * Read a bond symbol.
	 */
	public BondKind readBond() throws SmilesSyntaxException{
		int c = peek();
		if(c<0){
			throw endOfInput();
		}
		BondKind kind = BondKind.fromSymbol(c).orElseThrow(this::invalid);
		cursor++;
		return kind;
	}

	/**
	 * Read {@code *} or an unbracketed organic or aromatic atom. Two letter
	 * symbols win over one letter ones, so {@code Cl} is chlorine.
	 */
	public AtomKind readUnbracketedAtom() throws SmilesSyntaxException{
		int c = peek();
		if(c<0){
			throw endOfInput();
		}
		if(c=='*'){
			cursor++;
			return AtomKind.star();
		}
		Element aromatic = aromaticElement(c);
		if(aromatic!=null){
			cursor++;
			return AtomKind.aromatic(aromatic);
		}
		int len = organicLength();
		if(len==0){
			throw invalid();
		}
		Element e = Element.fromSymbol(text.substring(cursor, cursor+len)).get();
		cursor+=len;
		return AtomKind.aliphatic(e);
	}

	/**
	 * Read a ring bond number: one digit, or {@code %} and two digits.
	 */
	public int readRingNumber() throws SmilesSyntaxException{
		int c = next();
		if(c>='0' && c<='9'){
			return c-'0';
		}
		if(c!='%'){
			cursor--;
			throw invalid();
		}
		return digit()*10 + digit();
	}

	private int digit() throws SmilesSyntaxException{
		int c = peek();
		if(c<0){
			throw endOfInput();
		}
		if(c<'0' || c>'9'){
			throw invalid();
		}
		cursor++;
		return c-'0';
	}

	/**
	 * Read up to maxDigits decimal digits.
	 * @return empty if the next character is not a digit.
	 */
	public OptionalInt readNumber(int maxDigits){
		int value=0;
		int read=0;
		while(read<maxDigits){
			int c = peek();
			if(c<'0' || c>'9'){
				break;
			}
			value = value*10 + (c-'0');
			cursor++;
			read++;
		}
		return read==0?OptionalInt.empty():OptionalInt.of(value);
	}

	/**
	 * The error for the character at the cursor: end of input if there is none.
	 */
	public SmilesSyntaxException invalid(){
		if(isDone()){
			return endOfInput();
		}
		return new SmilesSyntaxException(Reason.INVALID_CHARACTER, cursor);
	}

	public SmilesSyntaxException invalidAt(int offset){
		return new SmilesSyntaxException(Reason.INVALID_CHARACTER, offset);
	}

	public SmilesSyntaxException endOfInput(){
		return new SmilesSyntaxException(Reason.END_OF_INPUT, text.length());
	}

	private int organicLength(){
		int c = peek();
		if(c<'A' || c>'Z'){
			return 0;
		}
		int c2 = peek(1);
		if(c2>='a' && c2<='z'){
			String two = text.substring(cursor, cursor+2);
			if(Element.fromSymbol(two).map(Element::isOrganic).orElse(false)){
				return 2;
			}
		}
		return Element.fromSymbol(String.valueOf((char)c)).map(Element::isOrganic).orElse(false)?1:0;
	}

	private static Element aromaticElement(int c){
		switch(c){
		case 'b':
			return Element.B;
		case 'c':
			return Element.C;
		case 'n':
			return Element.N;
		case 'o':
			return Element.O;
		case 'p':
			return Element.P;
		case 's':
			return Element.S;
		default:
			return null;
		}
	}
}
