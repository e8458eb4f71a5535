package com.buildflow.security.config;

import com.buildflow.database.pool.TenantPoolManager;
import com.buildflow.security.rbac.AgencyDatabaseRoleRepository;
import com.buildflow.security.rbac.MainDatabaseRoleRepository;
import com.buildflow.security.rbac.RbacAuthorizer;
import com.buildflow.security.rbac.UserRoleRepository;
import com.buildflow.security.token.TokenCodec;
import com.buildflow.security.token.TokenProperties;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Token and RBAC beans. Expects the {@link TenantPoolManager} and {@link Clock} from the database
 * configuration.
 */
@Configuration
@EnableConfigurationProperties(TokenProperties.class)
public class SecurityConfiguration {

    @Bean
    public TokenCodec tokenCodec(TokenProperties properties, Clock clock) {
        return new TokenCodec(properties, clock);
    }

    @Bean
    public MainDatabaseRoleRepository mainDatabaseRoleRepository(TenantPoolManager poolManager) {
        return new MainDatabaseRoleRepository(poolManager);
    }

    @Bean
    public AgencyDatabaseRoleRepository agencyDatabaseRoleRepository(TenantPoolManager poolManager) {
        return new AgencyDatabaseRoleRepository(poolManager);
    }

    @Bean
    public RbacAuthorizer rbacAuthorizer(List<UserRoleRepository> roleRepositories) {
        return new RbacAuthorizer(roleRepositories);
    }
}
