package nl.uu.medical.diagnosis.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosisEngineProducerTest {

    @Test
    void producesOneEngineAndItsStore() {
        DiagnosisEngineProducer producer = new DiagnosisEngineProducer(DiagnosisConfigFactory.create());
        producer.init();

        assertNotNull(producer.engine());
        assertSame(producer.engine(), producer.engine());
        assertSame(producer.engine().store(), producer.store());
    }
}
