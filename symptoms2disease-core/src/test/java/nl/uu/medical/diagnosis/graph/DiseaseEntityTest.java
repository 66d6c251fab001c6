package nl.uu.medical.diagnosis.graph;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DiseaseEntityTest {

    private static SymptomEntity symptom(String name) {
        return new SymptomEntity("http://uu.nl/medical/" + name, Map.of("en", name), Set.of());
    }

    @Test
    void rolesMissingFromTheMapAreEmpty() {
        SymptomEntity fever = symptom("Fever");
        SymptomEntity cough = symptom("Cough");
        Map<SymptomRole, List<SymptomEntity>> roles = new EnumMap<>(SymptomRole.class);
        roles.put(SymptomRole.PRIMARY, List.of(fever, cough));

        DiseaseEntity flu = new DiseaseEntity("http://uu.nl/medical/Influenza", Map.of("en", "Influenza"), Set.of(), roles);

        assertEquals(Set.of(fever, cough), flu.symptoms(SymptomRole.PRIMARY));
        for (SymptomRole role : SymptomRole.values()) {
            assertNotNull(flu.symptoms(role));
        }
        assertEquals(Set.of(fever, cough), flu.allSymptoms());
        assertEquals(Optional.of(SymptomRole.PRIMARY), flu.roleOf(cough));
    }

    @Test
    void edgeSetsAreImmutableCopies() {
        SymptomEntity rash = symptom("Rash");
        Map<SymptomRole, Set<SymptomEntity>> roles = Map.of(SymptomRole.PRIMARY, Set.of(rash));

        DiseaseEntity measles = new DiseaseEntity("http://uu.nl/medical/Measles", Map.of(), Set.of(), roles);

        assertThrows(UnsupportedOperationException.class,
                () -> measles.symptoms(SymptomRole.PRIMARY).add(symptom("Fever")));
        assertTrue(measles.roleOf(symptom("Fever")).isEmpty());
    }
}
