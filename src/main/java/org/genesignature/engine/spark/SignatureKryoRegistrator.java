package org.genesignature.engine.spark;

import com.esotericsoftware.kryo.Kryo;
import org.apache.spark.serializer.KryoRegistrator;
import org.genesignature.tools.signature.similarity.LabeledMatrix;

/**
 * Registers the serializers of the types broadcast to, or returned from, Spark executors.
 */
public class SignatureKryoRegistrator implements KryoRegistrator {

    public SignatureKryoRegistrator() {}

    @Override
    public void registerClasses(final Kryo kryo) {
        kryo.register(LabeledMatrix.class, new LabeledMatrix.Serializer());
    }
}
