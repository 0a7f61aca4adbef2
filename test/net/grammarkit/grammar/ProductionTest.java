package net.grammarkit.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProductionTest {

    @Test
    public void renderingConcatenatesSymbols() {
        Production p = Production.of(new Terminal("a"), new NonTerminal("A"),
                                     new Terminal("bc"));
        assertEquals("aAbc", p.toString());
        assertEquals(3, p.length());
        p.freeze();
        assertEquals("aAbc", p.toString());
        assertEquals(3, p.length());
    }

    @Test
    public void emptyProductionIsValid() {
        Production p = new Production();
        p.freeze();
        assertTrue(p.isEmpty());
        assertEquals("", p.toString());
        assertEquals(0, p.length());
        Production q = new Production();
        q.freeze();
        assertEquals(p, q);
    }

    @Test
    public void freezingCascadesToSymbols() {
        Terminal a = new Terminal("a");
        Production p = Production.of(a);
        p.freeze();
        assertTrue(a.isFrozen());
        assertThrows(LockedMutationException.class, () -> a.setText("b"));
    }

    @Test
    public void frozenMembersCannotBeUnlocked() {
        Production p = Production.of(new Terminal("a"));
        p.freeze();
        int hash = p.hashCode();
        assertThrows(LockedMutationException.class, () -> p.get(0).unlock());
        assertThrows(LockedMutationException.class,
                     () -> p.get(0).setText("zzz"));
        assertEquals("a", p.get(0).getText());

        Production q = Production.of(new Terminal("a"));
        q.freeze();
        assertEquals(q, p);
        assertEquals(hash, p.hashCode());
    }

    @Test
    public void callerReferencesStayPinned() {
        Terminal a = new Terminal("a");
        Production p = Production.of(a, new NonTerminal("B"));
        p.freeze();
        assertTrue(a.isHeld());
        assertThrows(LockedMutationException.class, () -> a.unlock());
        assertEquals("aB", p.toString());
    }

    @Test
    public void unlockingProductionReleasesMembers() {
        Terminal a = new Terminal("a");
        Production p = Production.of(a);
        p.freeze();
        p.unlock();
        assertFalse(a.isHeld());
        a.unlock();
        a.setText("b");
        p.freeze();
        assertEquals("b", p.toString());
    }

    @Test
    public void sharedSymbolStaysPinnedWhileAnyHolderIsFrozen() {
        Terminal a = new Terminal("a");
        Production p = Production.of(a);
        Production q = Production.of(a, new Terminal("c"));
        p.freeze();
        q.freeze();
        p.unlock();
        assertThrows(LockedMutationException.class, () -> a.unlock());
        q.unlock();
        a.unlock();
        assertFalse(a.isFrozen());
    }

    @Test
    public void clonedMembersAreNotPinnedByTheSource() {
        Production p = Production.of(new Terminal("a"));
        p.freeze();
        Production copy = p.clone(false);
        assertFalse(copy.get(0).isHeld());
        copy.get(0).unlock();
        copy.get(0).setText("b");
        assertEquals("a", p.toString());
        assertEquals("b", copy.toString());
        assertTrue(p.clone(true).get(0).isHeld());
    }

    @Test
    public void equalityDependsOnOrder() {
        Production p = Production.of(new Terminal("a"), new NonTerminal("A"));
        Production q = Production.of(new NonTerminal("A"), new Terminal("a"));
        p.freeze();
        q.freeze();
        assertNotEquals(p, q);
    }

    @Test
    public void equalityDependsOnVariants() {
        Production p = Production.of(new Terminal("a"));
        Production q = Production.of(new NonTerminal("a"));
        p.freeze();
        q.freeze();
        assertEquals(p.toString(), q.toString());
        assertNotEquals(p, q);
    }

    @Test
    public void equalityDependsOnSymbolBoundaries() {
        Production p = Production.of(new Terminal("ab"));
        Production q = Production.of(new Terminal("a"), new Terminal("b"));
        p.freeze();
        q.freeze();
        assertNotEquals(p, q);
    }

    @Test
    public void independentlyBuiltProductionsAreEqual() {
        Production p = Production.of(new Terminal("a"), new NonTerminal("A"));
        Production q = new Production();
        q.add(new Terminal("a"));
        q.add(new NonTerminal("A"));
        p.freeze();
        q.freeze();
        assertEquals(p, q);
        assertEquals(p.hashCode(), q.hashCode());
    }

    @Test
    public void mutatorsEditSequence() {
        Production p = Production.of(new Terminal("a"), new Terminal("c"));
        p.add(1, new Terminal("b"));
        assertEquals("abc", p.toString());
        assertEquals("a", p.remove(0).getText());
        assertEquals("bc", p.toString());
        p.clear();
        assertTrue(p.isEmpty());
        assertThrows(NullPointerException.class, () -> p.add(null));
    }

    @Test
    public void symbolViewIsReadOnly() {
        Production p = Production.of(new Terminal("a"));
        assertThrows(UnsupportedOperationException.class,
                     () -> p.getSymbols().add(new Terminal("b")));
    }

    @Test
    public void cloneIsDeep() {
        Terminal a = new Terminal("a");
        Production p = Production.of(a, new NonTerminal("A"));
        p.freeze();
        Production copy = p.clone(false);
        assertFalse(copy.isFrozen());
        assertNotSame(a, copy.get(0));
        assertTrue(copy.get(0).isFrozen());
        copy.add(new Terminal("b"));
        assertEquals(2, p.size());
        assertEquals("aAb", copy.toString());

        Production frozenCopy = p.clone(true);
        assertTrue(frozenCopy.isFrozen());
        assertEquals(p, frozenCopy);
        assertThrows(LockedMutationException.class,
                     () -> frozenCopy.add(new Terminal("b")));
    }

    @Test
    public void cloneOfMutableProductionKeepsSymbolsMutable() {
        Terminal a = new Terminal("a");
        Production p = Production.of(a);
        Production copy = p.clone(false);
        copy.get(0).setText("z");
        assertEquals("a", a.getText());
        assertEquals("z", copy.toString());
    }

}
