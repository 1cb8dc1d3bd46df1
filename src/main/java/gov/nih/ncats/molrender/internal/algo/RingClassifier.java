package gov.nih.ncats.molrender.internal.algo;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import gov.nih.ncats.molrender.internal.util.ConnectionTable;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Edge;
import gov.nih.ncats.molrender.internal.util.ConnectionTable.Node;

/**
 * Finds the atoms that lie on at least one cycle.
 * <p>
 * A depth first search is started from every atom, carrying the current
 * path. Meeting an atom that is still on the path through any bond other
 * than the one just walked closes a cycle, and every atom on the path from
 * that atom down to the current one is marked. This is O(V*(V+E)) which is
 * fine for structures of a few dozen atoms; a single low-link pass would be
 * needed for much larger graphs.
 */
public final class RingClassifier{

	private RingClassifier(){
	}

	public static BitSet findRingAtoms(ConnectionTable ct){
		BitSet inRing = new BitSet(ct.getNodes().size());
		for(Node start : ct.getNodes()){
			if(inRing.get(start.getIndex())){
				continue;
			}
			BitSet visited = new BitSet(ct.getNodes().size());
			List<Node> path = new ArrayList<>();
			walk(start, -1, visited, path, inRing);
		}
		return inRing;
	}

	private static void walk(Node n, int viaEdge, BitSet visited, List<Node> path, BitSet inRing){
		visited.set(n.getIndex());
		path.add(n);

		for(Edge e : n.getEdges()){
			if(e.getIndex()==viaEdge){
				continue;
			}
			Node other = e.getOtherNode(n);
			int onPath = path.indexOf(other);
			if(onPath>=0){
				for(int i=onPath;i<path.size();i++){
					inRing.set(path.get(i).getIndex());
				}
			}else if(!visited.get(other.getIndex())){
				walk(other, e.getIndex(), visited, path, inRing);
			}
		}

		path.remove(path.size()-1);
	}
}
