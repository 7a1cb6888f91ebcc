package com.hronboard.backend.modules.template.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.hronboard.backend.modules.template.domain.TemplateItem;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TemplateItemRepository extends JpaRepository<TemplateItem, UUID> {

    @Query("""
            select ti.template.id as templateId, count(ti) as itemCount
              from TemplateItem ti
             where ti.template.id in :templateIds
             group by ti.template.id
            """)
    List<ItemCountProjection> countByTemplateIds(@Param("templateIds") List<UUID> templateIds);

    interface ItemCountProjection {

        UUID getTemplateId();

        long getItemCount();
    }
}
