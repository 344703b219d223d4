package com.flipkart.fieldguard.authz;

import com.flipkart.fieldguard.models.exception.PermissionDeniedException;
import com.flipkart.fieldguard.models.resolved.AuthorizedOutcome;
import com.flipkart.fieldguard.models.resolved.CollectionValue;
import com.flipkart.fieldguard.models.resolved.EntityValue;
import com.flipkart.fieldguard.models.resolved.FieldContext;
import com.flipkart.fieldguard.models.resolved.MixedSequenceValue;
import com.flipkart.fieldguard.models.resolved.PlainValue;
import com.flipkart.fieldguard.models.resolved.ResolvedValue;
import com.flipkart.fieldguard.spi.authz.Principal;
import com.flipkart.fieldguard.spi.models.EntityKind;
import com.flipkart.fieldguard.spi.models.GuardedEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.flipkart.fieldguard.spi.authz.PermissionNames.viewPermission;

/**
 * Decides, for every resolved field value, whether the principal may see it.
 * <p>
 * The interceptor is invoked once per field, after the resolver ran and before the engine merges the value into
 * the response or resolves child fields from it. Since children are resolved from the authorized value, decisions
 * compose depth-first through the whole response tree.
 * <ul>
 *   <li>A single entity is kept if the principal holds the view permission for its kind or for the instance.
 *   Otherwise a nullable field becomes null, and a non-null field fails with a {@link PermissionDeniedException},
 *   since the schema does not allow it to be omitted.</li>
 *   <li>A collection of one kind is kept whole with the model level permission, otherwise it is filtered to the
 *   instances the principal may view. An empty list is valid for any list field, so this never fails.</li>
 *   <li>A mixed sequence keeps its plain members and the entities that pass the single entity rule. Never fails.</li>
 *   <li>Anything else passes through.</li>
 * </ul>
 * The interceptor holds no state. It only reads from the principal's permission oracle.
 */
@Slf4j
@Component
public class FieldAuthorizationInterceptor {

    public AuthorizedOutcome intercept(Principal principal, ResolvedValue value, FieldContext field) {
        if (value instanceof EntityValue entityValue) {
            return authorizeEntity(principal, entityValue.entity(), field);
        }
        if (value instanceof CollectionValue collection) {
            return authorizeCollection(principal, collection);
        }
        if (value instanceof MixedSequenceValue sequence) {
            return authorizeMixedSequence(principal, sequence);
        }
        if (value instanceof PlainValue plain) {
            return AuthorizedOutcome.passThrough(plain.value());
        }
        throw new IllegalStateException("Unsupported resolved value: " + value);
    }

    private AuthorizedOutcome authorizeEntity(Principal principal, GuardedEntity entity, FieldContext field) {
        String permission = viewPermission(entity.getEntityKind());
        if (principal.hasModelPermission(permission) || principal.hasInstancePermission(permission, entity)) {
            return AuthorizedOutcome.passThrough(entity);
        }
        log.debug("{} lacks {} at {}", principal, permission, field.path());
        if (field.nonNull()) {
            return AuthorizedOutcome.denied(new PermissionDeniedException(field.path()));
        }
        return AuthorizedOutcome.redacted();
    }

    private AuthorizedOutcome authorizeCollection(Principal principal, CollectionValue collection) {
        String permission = viewPermission(collection.kind());
        if (principal.hasModelPermission(permission)) {
            return AuthorizedOutcome.passThrough(collection.raw());
        }
        // single pass over the fetched result; narrowing the query instead would hit the data source again
        List<GuardedEntity> retained = new ArrayList<>();
        for (GuardedEntity member : collection.members()) {
            if (principal.hasInstancePermission(permission, member)) {
                retained.add(member);
            }
        }
        return AuthorizedOutcome.filtered(retained);
    }

    private AuthorizedOutcome authorizeMixedSequence(Principal principal, MixedSequenceValue sequence) {
        Map<EntityKind, Boolean> modelGrants = new HashMap<>();
        List<Object> retained = new ArrayList<>(sequence.members().size());
        for (Object member : sequence.members()) {
            if (!(member instanceof GuardedEntity entity)) {
                retained.add(member);
                continue;
            }
            String permission = viewPermission(entity.getEntityKind());
            boolean kindGranted = modelGrants.computeIfAbsent(entity.getEntityKind(),
                    kind -> principal.hasModelPermission(permission));
            if (kindGranted || principal.hasInstancePermission(permission, entity)) {
                retained.add(entity);
            }
        }
        return AuthorizedOutcome.filtered(retained);
    }
}
