package com.hronboard.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u where lower(u.email) = lower(:email)")
    Optional<AppUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from AppUser u
             where lower(u.email) = lower(:email)
            """)
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from AppUser u
             where lower(u.email) = lower(:email)
               and u.id <> :excludedId
            """)
    boolean existsByEmailIgnoreCaseAndIdNot(@Param("email") String email, @Param("excludedId") UUID excludedId);

    boolean existsByRole(UserRole role);

    Optional<AppUser> findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(UserRole role, Collection<UUID> excludedIds);

    @Query("""
            select u
              from AppUser u
             where (:role is null or u.role = :role)
               and (:active is null or u.active = :active)
            """)
    Page<AppUser> search(@Param("role") UserRole role, @Param("active") Boolean active, Pageable pageable);
}
