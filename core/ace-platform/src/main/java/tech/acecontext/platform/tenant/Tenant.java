package tech.acecontext.platform.tenant;

import java.time.Instant;

/**
 * The unit of data isolation. One tenant exists per federated identity.
 */
public class Tenant {

    /**
     * The federated provider's subject claim, used verbatim.
     */
    public String id;

    public String email;

    public Instant createdAt = Instant.now();
}
