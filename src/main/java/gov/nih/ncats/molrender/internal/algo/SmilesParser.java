package gov.nih.ncats.molrender.internal.algo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.molrender.ParseDiagnostic;
import gov.nih.ncats.molrender.ParseDiagnostic.Kind;
import gov.nih.ncats.molrender.internal.util.ConnectionTable;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.BondOrder;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.BondStereo;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Chirality;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Edge;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Node;

/**
 * Lenient SMILES reader. A single left to right scan driven by a small
 * state machine; anything it does not understand is skipped and recorded
 * as a {@link ParseDiagnostic}, never thrown.
 * <p>
 * One instance reads one string:
 * <pre>
 * SmilesParser parser = new SmilesParser("CC(=O)O");
 * ConnectionTable ct = parser.getCtab();
 * List&lt;ParseDiagnostic&gt; skipped = parser.getDiagnostics();
 * </pre>
 */
public class SmilesParser{
	private static final Logger logger =
			Logger.getLogger(SmilesParser.class.getName());

	enum State{
		SCANNING,
		IN_BRACKET_ATOM,
		IN_BRANCH,
		AWAITING_RING_DIGIT
	}

	enum CharClass{
		BRANCH_OPEN,
		BRANCH_CLOSE,
		RING_DIGIT,
		RING_PERCENT,
		BRACKET_OPEN,
		ORGANIC_ATOM,
		BOND,
		DOT,
		OTHER;

		static CharClass of(char c){
			switch(c){
				case '(': return BRANCH_OPEN;
				case ')': return BRANCH_CLOSE;
				case '%': return RING_PERCENT;
				case '[': return BRACKET_OPEN;
				case '.': return DOT;
				case '=':
				case '#':
				case '-':
				case '/':
				case '\\':
				case ':':
					return BOND;
				case 'C': case 'N': case 'O': case 'S': case 'P':
				case 'F': case 'I': case 'B':
				case 'c': case 'n': case 'o': case 's': case 'p':
					return ORGANIC_ATOM;
				default:
					if(c>='0' && c<='9'){
						return RING_DIGIT;
					}
					return OTHER;
			}
		}
	}

	private static final int MAX_NUMBER_DIGITS = 3;

	/**
	 * Next state for every (state, input class) pair. IN_BRACKET_ATOM and
	 * AWAITING_RING_DIGIT consume their whole token in one step and then fall
	 * back to SCANNING or IN_BRANCH depending on the branch depth, so their
	 * rows only ever lead back to a resting state.
	 */
	private static final Map<State,Map<CharClass,State>> TRANSITIONS = new EnumMap<>(State.class);

	static{
		for(State resting : new State[]{State.SCANNING, State.IN_BRANCH}){
			Map<CharClass,State> row = new EnumMap<>(CharClass.class);
			for(CharClass cc : CharClass.values()){
				row.put(cc, resting);
			}
			row.put(CharClass.BRANCH_OPEN, State.IN_BRANCH);
			row.put(CharClass.BRACKET_OPEN, State.IN_BRACKET_ATOM);
			row.put(CharClass.RING_PERCENT, State.AWAITING_RING_DIGIT);
			TRANSITIONS.put(resting, row);
		}
		for(State consuming : new State[]{State.IN_BRACKET_ATOM, State.AWAITING_RING_DIGIT}){
			Map<CharClass,State> row = new EnumMap<>(CharClass.class);
			for(CharClass cc : CharClass.values()){
				row.put(cc, State.SCANNING);
			}
			TRANSITIONS.put(consuming, row);
		}
	}

	static State transition(State from, CharClass input){
		return TRANSITIONS.get(from).get(input);
	}

	private static class RingOpening{
		final Node node;
		final Character bond;
		final int position;

		RingOpening(Node node, Character bond, int position){
			this.node=node;
			this.bond=bond;
			this.position=position;
		}
	}

	private final String smiles;
	private final ConnectionTable ct = new ConnectionTable();
	private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

	private final Stack<Node> branches = new Stack<>();
	private final Stack<Integer> branchPositions = new Stack<>();
	private final Map<Integer,RingOpening> openRings = new LinkedHashMap<>();

	private State state = State.SCANNING;
	private int pos=0;
	private Node current=null;
	private Character pendingBond=null;
	private boolean parsed=false;

	public SmilesParser(String smiles){
		this.smiles = smiles==null?"":smiles;
	}

	/**
	 * Parses the notation (on first call) and returns the resulting graph.
	 * @return the graph, possibly empty, never null.
	 */
	public ConnectionTable getCtab(){
		if(!parsed){
			parse();
			parsed=true;
		}
		return ct;
	}

	public List<ParseDiagnostic> getDiagnostics(){
		getCtab();
		return Collections.unmodifiableList(diagnostics);
	}

	State getState(){
		return state;
	}

	private void parse(){
		while(pos<smiles.length()){
			char c = smiles.charAt(pos);
			CharClass cc = CharClass.of(c);
			state = transition(state, cc);

			switch(state){
				case IN_BRACKET_ATOM:
					readBracketAtom();
					state = restingState();
					break;
				case AWAITING_RING_DIGIT:
					readRingNumber();
					state = restingState();
					break;
				default:
					handle(cc, c);
					state = restingState();
					break;
			}
		}

		while(!branches.isEmpty()){
			branches.pop();
			warn(branchPositions.pop(), Kind.UNCLOSED_BRANCH, "branch opened here is never closed");
		}
		openRings.forEach((num,open)->
			warn(open.position, Kind.UNCLOSED_RING, "ring closure " + num + " is never closed; no bond created"));

		if(!diagnostics.isEmpty() && logger.isLoggable(Level.FINE)){
			logger.fine("parsed '" + smiles + "' with " + diagnostics.size() + " skipped token(s): " + diagnostics);
		}
	}

	private State restingState(){
		return branches.isEmpty()?State.SCANNING:State.IN_BRANCH;
	}

	private void handle(CharClass cc, char c){
		switch(cc){
			case BRANCH_OPEN:
				branches.push(current);
				branchPositions.push(pos);
				pos++;
				break;
			case BRANCH_CLOSE:
				if(branches.isEmpty()){
					warn(pos, Kind.UNMATCHED_BRANCH_CLOSE, "')' without matching '('");
				}else{
					current = branches.pop();
					branchPositions.pop();
				}
				pos++;
				break;
			case RING_DIGIT:
				ringClosure(c - '0', pos);
				pos++;
				break;
			case ORGANIC_ATOM:
				readOrganicAtom();
				break;
			case BOND:
				pendingBond = c;
				pos++;
				break;
			case DOT:
				current=null;
				pendingBond=null;
				pos++;
				break;
			default:
				warn(pos, Kind.UNKNOWN_CHARACTER, "skipped '" + c + "'");
				pos++;
				break;
		}
	}

	private void readOrganicAtom(){
		char c = smiles.charAt(pos);
		boolean aromatic = Character.isLowerCase(c);
		String symbol = String.valueOf(Character.toUpperCase(c));
		if(c=='C' && peek(1)=='l'){
			symbol="Cl";
			pos++;
		}else if(c=='B' && peek(1)=='r'){
			symbol="Br";
			pos++;
		}
		pos++;
		Node atom = ct.addNode(symbol).setAromatic(aromatic);
		bondToCurrent(atom);
		current = atom;
	}

	private void readBracketAtom(){
		int start = pos;
		pos++; //skip [

		int isotope = readNumber();

		if(pos>=smiles.length() || !Character.isLetter(smiles.charAt(pos))){
			warn(start, Kind.UNKNOWN_CHARACTER, "bracket atom without element symbol");
			skipToBracketEnd(start);
			return;
		}
		char first = smiles.charAt(pos++);
		boolean aromatic = Character.isLowerCase(first);
		StringBuilder symbol = new StringBuilder().append(Character.toUpperCase(first));
		if(pos<smiles.length() && Character.isLowerCase(smiles.charAt(pos))){
			symbol.append(smiles.charAt(pos++));
		}

		Chirality chirality = Chirality.NONE;
		if(peek(0)=='@'){
			pos++;
			chirality = Chirality.ANTICLOCKWISE;
			if(peek(0)=='@'){
				pos++;
				chirality = Chirality.CLOCKWISE;
			}
		}

		int hCount=0;
		if(peek(0)=='H'){
			pos++;
			int n = readNumber();
			hCount = n<0?1:n;
		}

		int charge=0;
		char sign = peek(0);
		if(sign=='+' || sign=='-'){
			int unit = sign=='+'?1:-1;
			pos++;
			int n = readNumber();
			if(n>=0){
				charge = unit*n;
			}else{
				charge = unit;
				while(peek(0)==sign){
					charge+=unit;
					pos++;
				}
			}
		}

		Node atom = ct.addNode(symbol.toString())
				.setAromatic(aromatic)
				.setIsotope(Math.max(0, isotope))
				.setChirality(chirality)
				.setExplicitHydrogens(hCount)
				.setCharge(charge);
		bondToCurrent(atom);
		current = atom;

		skipToBracketEnd(start);
	}

	private void skipToBracketEnd(int start){
		int ignoredFrom = pos;
		while(pos<smiles.length() && smiles.charAt(pos)!=']'){
			pos++;
		}
		if(pos>ignoredFrom){
			warn(ignoredFrom, Kind.UNKNOWN_CHARACTER, "ignored '" + smiles.substring(ignoredFrom, pos) + "' inside bracket atom");
		}
		if(pos>=smiles.length()){
			warn(start, Kind.UNTERMINATED_BRACKET_ATOM, "'[' without matching ']'");
		}else{
			pos++; //skip ]
		}
	}

	private void readRingNumber(){
		int start = pos;
		pos++; //skip %
		if(Character.isDigit(peek(0)) && Character.isDigit(peek(1))){
			int num = (peek(0)-'0')*10 + (peek(1)-'0');
			pos+=2;
			ringClosure(num, start);
		}else{
			warn(start, Kind.MALFORMED_RING_NUMBER, "'%' must be followed by two digits");
		}
	}

	private void ringClosure(int number, int at){
		Character bond = pendingBond;
		pendingBond=null;
		if(current==null){
			warn(at, Kind.RING_WITHOUT_ATOM, "ring closure " + number + " has no atom to attach to");
			return;
		}
		RingOpening open = openRings.remove(number);
		if(open==null){
			openRings.put(number, new RingOpening(current, bond, at));
			return;
		}
		if(open.node==current || current.connectsTo(open.node)){
			warn(at, Kind.INVALID_RING_CLOSURE, "ring closure " + number + " would duplicate a bond; dropped");
			return;
		}
		Edge e = ct.addEdge(current.getIndex(), open.node.getIndex(), BondOrder.SINGLE);
		applyBondSymbol(e, bond!=null?bond:open.bond);
	}

	private void bondToCurrent(Node atom){
		if(current!=null){
			Edge e = ct.addEdge(current.getIndex(), atom.getIndex(), BondOrder.SINGLE);
			applyBondSymbol(e, pendingBond);
		}
		pendingBond=null;
	}

	private static void applyBondSymbol(Edge e, Character symbol){
		if(symbol==null){
			if(e.getRealNode1().isAromatic() && e.getRealNode2().isAromatic()){
				e.setToAromatic();
			}
			return;
		}
		switch(symbol){
			case '=':
				e.setOrder(BondOrder.DOUBLE);
				break;
			case '#':
				e.setOrder(BondOrder.TRIPLE);
				break;
			case '/':
				e.setStereo(BondStereo.UP);
				break;
			case '\\':
				e.setStereo(BondStereo.DOWN);
				break;
			case ':':
				e.setToAromatic();
				break;
			default:
				//'-' explicit single
				break;
		}
	}

	/**
	 * Reads a run of digits at the cursor. Only the first
	 * {@value #MAX_NUMBER_DIGITS} digits count, the rest of the run is skipped
	 * with a diagnostic.
	 * @return the value, or -1 if the cursor is not on a digit.
	 */
	private int readNumber(){
		if(!isAsciiDigit(peek(0))){
			return -1;
		}
		int v=0;
		int digits=0;
		while(isAsciiDigit(peek(0)) && digits<MAX_NUMBER_DIGITS){
			v = v*10 + (smiles.charAt(pos)-'0');
			pos++;
			digits++;
		}
		int extra = pos;
		while(isAsciiDigit(peek(0))){
			pos++;
		}
		if(pos>extra){
			warn(extra, Kind.UNKNOWN_CHARACTER, "ignored digits '" + smiles.substring(extra, pos)
					+ "', numbers in a bracket atom have at most " + MAX_NUMBER_DIGITS + " digits");
		}
		return v;
	}

	private static boolean isAsciiDigit(char c){
		return c>='0' && c<='9';
	}

	private char peek(int ahead){
		int i = pos+ahead;
		if(i<smiles.length()){
			return smiles.charAt(i);
		}
		return '\0';
	}

	private void warn(int at, Kind kind, String message){
		diagnostics.add(new ParseDiagnostic(at, kind, message));
	}
}
