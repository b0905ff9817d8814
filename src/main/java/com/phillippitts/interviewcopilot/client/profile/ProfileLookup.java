package com.phillippitts.interviewcopilot.client.profile;

import com.phillippitts.interviewcopilot.domain.ContextPayload;

/**
 * Source of the candidate profile sent as session context.
 *
 * <p>Implementations never return null; a user without a profile gets {@link ContextPayload#EMPTY}.
 */
@FunctionalInterface
public interface ProfileLookup {

    ContextPayload lookup(String userId);
}
