package eu.virtualparadox.lexqa.catalog.repo;

import eu.virtualparadox.lexqa.catalog.entity.ChunkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ChunkRepository extends JpaRepository<ChunkEntity, String> {

    List<ChunkEntity> findByDocIdOrderBySequence(String docId);

    List<ChunkEntity> findByChunkIdIn(Collection<String> chunkIds);

    @Modifying
    @Query("delete from ChunkEntity c where c.docId = :docId")
    int deleteByDocId(@Param("docId") String docId);
}
