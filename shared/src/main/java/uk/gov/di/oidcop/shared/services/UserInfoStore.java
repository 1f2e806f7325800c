package uk.gov.di.oidcop.shared.services;

import java.util.Collection;
import java.util.Map;

public interface UserInfoStore {

    /** Returns the values held for the requested claims. Unknown users yield an empty map. */
    Map<String, Object> getUserClaims(String userId, Collection<String> claimNames);
}
