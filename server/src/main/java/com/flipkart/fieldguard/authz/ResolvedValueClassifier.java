package com.flipkart.fieldguard.authz;

import com.flipkart.fieldguard.models.resolved.CollectionValue;
import com.flipkart.fieldguard.models.resolved.EntitySequence;
import com.flipkart.fieldguard.models.resolved.EntityValue;
import com.flipkart.fieldguard.models.resolved.MixedSequenceValue;
import com.flipkart.fieldguard.models.resolved.PlainValue;
import com.flipkart.fieldguard.models.resolved.ResolvedValue;
import com.flipkart.fieldguard.spi.models.GuardedEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Turns whatever a resolver returned into a {@link ResolvedValue}.
 * <p>
 * In-memory collections, arrays and other iterables become a {@link MixedSequenceValue}, even when every member
 * is an entity of the same kind, since only an {@link EntitySequence} declares its kind up front. A generic
 * iterable is drained into a list here and the list is what the engine renders afterwards.
 */
@Component
public class ResolvedValueClassifier {

    public ResolvedValue classify(Object value) {
        if (value == null) {
            return PlainValue.NULL;
        }
        if (value instanceof GuardedEntity entity) {
            return new EntityValue(entity);
        }
        if (value instanceof EntitySequence<?> sequence) {
            return new CollectionValue(sequence);
        }
        if (value instanceof List<?> list) {
            return new MixedSequenceValue(list);
        }
        if (value instanceof Collection<?> collection) {
            return new MixedSequenceValue(new ArrayList<>(collection));
        }
        if (value instanceof Object[] array) {
            return new MixedSequenceValue(Arrays.asList(array));
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> members = new ArrayList<>();
            iterable.forEach(members::add);
            return new MixedSequenceValue(members);
        }
        return new PlainValue(value);
    }
}
