package tech.acecontext.platform.authentication;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marker annotation for JAX-RS resources and methods that act on behalf of a tenant.
 *
 * Requests are run through {@link BearerTokenFilter}, which populates
 * {@link TenantContext} and, when {@code ace.auth.required=true}, rejects
 * requests without a valid bearer token.
 *
 * Usage:
 * <pre>
 * {@literal @}Path("/api/playbook")
 * {@literal @}RequiresTenant
 * public class PlaybookResource {
 *     {@literal @}Inject TenantContext tenantContext;
 * }
 * </pre>
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresTenant {
}
