package eu.virtualparadox.lexqa.catalog.repo;

import eu.virtualparadox.lexqa.catalog.EDocumentStatus;
import eu.virtualparadox.lexqa.catalog.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findAllByOrderByAddedAtAsc();

    @Modifying
    @Query("update DocumentEntity d set d.status = :status where d.id = :id")
    int updateStatus(@Param("id") String id, @Param("status") EDocumentStatus status);
}
