package app.lexis.core.deck.repository;

import app.lexis.core.deck.domain.entity.DeckEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeckRepository extends JpaRepository<DeckEntity, String> {

    List<DeckEntity> findAllByOrderByCreatedAtAsc();
}
