package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.snapup_be.pojo.ChatMessage;

import java.util.List;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    @Query("SELECT m FROM ChatMessage m WHERE m.listing.listingId = :listingId " +
           "AND ((m.sender.userId = :userA AND m.receiver.userId = :userB) " +
           "OR (m.sender.userId = :userB AND m.receiver.userId = :userA)) " +
           "ORDER BY m.createdAt ASC")
    List<ChatMessage> findConversation(@Param("listingId") Long listingId,
                                       @Param("userA") Long userA,
                                       @Param("userB") Long userB);
}
