package gov.nih.ncats.molrender.internal.algo;

import static org.junit.Assert.*;

import java.util.BitSet;

import org.junit.Test;

public class RingClassifierTest {

	private static BitSet ringAtoms(String smiles){
		return RingClassifier.findRingAtoms(new SmilesParser(smiles).getCtab());
	}

	@Test
	public void cyclohexaneAllInRing(){
		BitSet bs = ringAtoms("C1CCCCC1");
		assertEquals(6, bs.cardinality());
	}

	@Test
	public void tolueneMethylNotInRing(){
		BitSet bs = ringAtoms("Cc1ccccc1");
		assertFalse(bs.get(0));
		for(int i=1;i<=6;i++){
			assertTrue("atom " + i, bs.get(i));
		}
	}

	@Test
	public void chainHasNoRingAtoms(){
		assertTrue(ringAtoms("CCOCC(C)C").isEmpty());
	}

	@Test
	public void fusedRings(){
		assertEquals(10, ringAtoms("c1ccc2ccccc2c1").cardinality());
	}

	@Test
	public void linkerBetweenRingsIsNotInRing(){
		BitSet bs = ringAtoms("C1CC1CCC1CC1");
		assertEquals(8, new SmilesParser("C1CC1CCC1CC1").getCtab().getNodes().size());
		assertTrue(bs.get(0));
		assertTrue(bs.get(1));
		assertTrue(bs.get(2));
		assertFalse(bs.get(3));
		assertFalse(bs.get(4));
		assertTrue(bs.get(5));
		assertTrue(bs.get(6));
		assertTrue(bs.get(7));
	}

	@Test
	public void spiroAtomIsInRing(){
		assertEquals(7, ringAtoms("C1CCC12CCC2").cardinality());
	}

	@Test
	public void emptyGraph(){
		assertTrue(ringAtoms("").isEmpty());
	}
}
