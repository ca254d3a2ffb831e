package com.nodeflow.vgc.api;

import org.junit.Test;

import java.util.UUID;

import static org.junit.Assert.*;

public class TypeDescriptorTest {

    @Test
    public void testSubtypeChain() {
        assertTrue(Types.BOOL.isSubtypeOf(Types.INT));
        assertTrue(Types.BOOL.isSubtypeOf(Types.OBJECT));
        assertTrue(Types.INT.isSubtypeOf(Types.INT));
        assertFalse(Types.INT.isSubtypeOf(Types.BOOL));
        assertFalse(Types.STR.isSubtypeOf(Types.INT));
    }

    @Test
    public void testEverythingIsAnObject() {
        TypeDescriptor orphan = new TypeDescriptor("Orphan", null);
        assertTrue(orphan.isSubtypeOf(Types.OBJECT));
    }

    @Test
    public void testCompatibilityIsSymmetric() {
        assertTrue(Types.INT.isCompatibleWith(Types.OBJECT));
        assertTrue(Types.OBJECT.isCompatibleWith(Types.INT));
        assertTrue(Types.BOOL.isCompatibleWith(Types.INT));
        assertFalse(Types.INT.isCompatibleWith(Types.STR));
        assertFalse(Types.STR.isCompatibleWith(Types.INT));
    }

    @Test
    public void testByNameRegistersUnknownTypesUnderObject() {
        assertSame(Types.INT, Types.byName("int"));
        assertSame(Types.OBJECT, Types.byName("Any"));
        assertSame(Types.OBJECT, Types.byName(null));

        TypeDescriptor frame = Types.byName("DataFrame");
        assertSame(frame, Types.byName("DataFrame"));
        assertEquals(Types.OBJECT, frame.supertype());
        assertFalse(frame.isCompatibleWith(Types.STR));
    }

    @Test
    public void testPortCompatibility() {
        Port out = Port.output("out", Types.BOOL);
        Port in = Port.input("in", Types.INT);
        assertTrue(out.isCompatibleWith(in));
        assertFalse(out.isCompatibleWith(null));
        assertFalse(out.required());
        assertEquals(Types.OBJECT, new Port("p", null, false, null, null).semanticType());
    }

    @Test
    public void testNodeEqualityIgnoresPosition() {
        UUID id = UUID.randomUUID();
        VisualNode a = VisualNode.builder().id(id).kind(NodeKind.VARIABLE)
                .position(new VisualNode.Position(1, 2)).build();
        VisualNode b = VisualNode.builder().id(id).kind(NodeKind.VARIABLE)
                .position(new VisualNode.Position(300, 400)).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, VisualNode.of(NodeKind.VARIABLE));
    }

    @Test
    public void testNodeKindFromString() {
        assertEquals(NodeKind.CONTROL_FLOW, NodeKind.fromString("control_flow"));
        assertEquals(NodeKind.CONTROL_FLOW, NodeKind.fromString("CONTROL_FLOW"));
        assertThrows(IllegalArgumentException.class, () -> NodeKind.fromString("widget"));
    }
}
