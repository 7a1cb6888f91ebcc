package com.hronboard.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.approval.domain.ApprovalRequest;
import com.hronboard.backend.modules.approval.domain.ApprovalStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, UUID> {

    @Query("""
            select case when count(ar) > 0 then true else false end
              from ApprovalRequest ar
             where ar.template.id = :templateId
               and ar.status = :status
            """)
    boolean existsByTemplateIdAndStatus(@Param("templateId") UUID templateId, @Param("status") ApprovalStatus status);

    @Query("""
            select ar
              from ApprovalRequest ar
              join fetch ar.template
             where ar.id = :requestId
               and ar.assignedTo.id = :assigneeId
               and ar.status = :status
            """)
    Optional<ApprovalRequest> findAssignedWithStatus(
            @Param("requestId") UUID requestId,
            @Param("assigneeId") UUID assigneeId,
            @Param("status") ApprovalStatus status);

    @Query(value = """
            select ar
              from ApprovalRequest ar
              join fetch ar.template
              join fetch ar.requestedBy
              join fetch ar.assignedTo
             where ar.assignedTo.id = :assigneeId
               and ar.status = :status
            """,
            countQuery = """
            select count(ar)
              from ApprovalRequest ar
             where ar.assignedTo.id = :assigneeId
               and ar.status = :status
            """)
    Page<ApprovalRequest> findByAssignee(
            @Param("assigneeId") UUID assigneeId,
            @Param("status") ApprovalStatus status,
            Pageable pageable);

    @Query("""
            select ar
              from ApprovalRequest ar
              join fetch ar.template
              join fetch ar.requestedBy
              join fetch ar.assignedTo
             where ar.id = :requestId
            """)
    Optional<ApprovalRequest> findDetailedById(@Param("requestId") UUID requestId);

    @Query("""
            select ar
              from ApprovalRequest ar
              join fetch ar.requestedBy
              join fetch ar.assignedTo
             where ar.template.id = :templateId
             order by ar.createdAt desc
            """)
    List<ApprovalRequest> findHistoryByTemplateId(@Param("templateId") UUID templateId);
}
