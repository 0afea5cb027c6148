package com.eventstorming.core.model;

import com.eventstorming.core.persistence.WorkshopJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private final ObjectMapper mapper = WorkshopJson.objectMapper();

    @Nested
    @DisplayName("ElementType")
    class ElementTypeTests {

        @Test
        @DisplayName("resolves wire names and constant names case-insensitively")
        void fromWireName() {
            assertEquals(ElementType.READ_MODEL, ElementType.fromWireName("read_model"));
            assertEquals(ElementType.READ_MODEL, ElementType.fromWireName("READ_MODEL"));
            assertEquals(ElementType.EXTERNAL_SYSTEM, ElementType.fromWireName(" External_System "));
        }

        @Test
        @DisplayName("unknown type is a validation error")
        void unknownType() {
            var e = assertThrows(WorkshopValidationException.class, () -> ElementType.fromWireName("saga"));
            assertTrue(e.getMessage().contains("saga"));
            assertThrows(WorkshopValidationException.class, () -> ElementType.fromWireName(null));
        }

        @Test
        @DisplayName("serializes as its wire name")
        void jsonWireName() throws Exception {
            assertEquals("\"external_system\"", mapper.writeValueAsString(ElementType.EXTERNAL_SYSTEM));
            assertEquals(ElementType.HOTSPOT, mapper.readValue("\"hotspot\"", ElementType.class));
        }

        @Test
        @DisplayName("every type carries a note color")
        void colors() {
            assertEquals("orange", ElementType.EVENT.color());
            assertEquals("lilac", ElementType.POLICY.color());
            for (ElementType type : ElementType.values()) {
                assertNotNull(type.color());
            }
        }
    }

    @Nested
    @DisplayName("ElementDraft")
    class DraftTests {

        @Test
        @DisplayName("requires type and name")
        void requiredFields() {
            assertThrows(WorkshopValidationException.class, () -> ElementDraft.of(null, "Order Placed"));
            assertThrows(WorkshopValidationException.class, () -> ElementDraft.of(ElementType.EVENT, "  "));
        }

        @Test
        @DisplayName("rejects negative positions")
        void negativePosition() {
            assertThrows(WorkshopValidationException.class, () ->
                    new ElementDraft(ElementType.EVENT, "Order Placed", -1, null, null, null, null, null));
        }

        @Test
        @DisplayName("strips the name and defaults trigger lists to empty")
        void defaults() {
            var draft = ElementDraft.of(ElementType.EVENT, "  Order Placed ");
            assertEquals("Order Placed", draft.name());
            assertEquals(List.of(), draft.triggers());
            assertEquals(List.of(), draft.triggeredBy());
            assertNull(draft.position());
        }
    }

    @Nested
    @DisplayName("ElementPatch")
    class PatchTests {

        @Test
        @DisplayName("empty patch is detected")
        void empty() {
            assertTrue(new ElementPatch(null, null, null, null, null, null).isEmpty());
            assertFalse(new ElementPatch(null, null, "", null, null, null).isEmpty());
        }

        @Test
        @DisplayName("blank name is rejected")
        void blankName() {
            assertThrows(WorkshopValidationException.class,
                    () -> new ElementPatch(" ", null, null, null, null, null));
        }
    }

    @Nested
    @DisplayName("Workshop")
    class WorkshopTests {

        @Test
        @DisplayName("requireElement and requireContext raise typed not-found errors")
        void requireMissing() {
            var workshop = new Workshop();
            var e1 = assertThrows(NotFoundException.class, () -> workshop.requireElement("e-1"));
            assertEquals(NotFoundException.Kind.ELEMENT, e1.getKind());
            assertEquals("Element not found: e-1", e1.getMessage());

            var e2 = assertThrows(NotFoundException.class, () -> workshop.requireContext("c-1"));
            assertEquals(NotFoundException.Kind.CONTEXT, e2.getKind());
            assertEquals("c-1", e2.getId());
        }

        @Test
        @DisplayName("serializes with snake_case keys and without a top-level id")
        void json() throws Exception {
            var metadata = new WorkshopMetadata();
            metadata.setId("w-1");
            metadata.setName("Checkout");
            var element = new Element();
            element.setId("e-1");
            element.setType(ElementType.EVENT);
            element.setName("Order Placed");
            element.setBoundedContextId("c-1");
            var workshop = new Workshop();
            workshop.setMetadata(metadata);
            workshop.getElements().add(element);

            var tree = mapper.valueToTree(workshop);
            assertFalse(tree.has("id"));
            assertEquals("w-1", tree.at("/metadata/id").asText());
            assertEquals("2.0", tree.at("/metadata/schema_version").asText());
            assertEquals("c-1", tree.at("/elements/0/bounded_context_id").asText());
            assertTrue(tree.at("/elements/0/triggered_by").isArray());
            assertTrue(tree.has("bounded_contexts"));
        }
    }

    @Test
    @DisplayName("BoundedContext membership never holds duplicates")
    void contextMembership() {
        var context = new BoundedContext();
        assertTrue(context.addMember("e-1"));
        assertFalse(context.addMember("e-1"));
        assertEquals(List.of("e-1"), context.getElementIds());
        assertTrue(context.removeMember("e-1"));
        assertFalse(context.removeMember("e-1"));
    }

    @Test
    @DisplayName("OperationResult failure carries only the error")
    void failureResult() {
        var result = OperationResult.failure("Workshop not found: w-9");
        assertFalse(result.success());
        assertNull(result.entityId());
        assertFalse(result.hasWarnings());
        assertEquals("Workshop not found: w-9", result.error());
    }
}
