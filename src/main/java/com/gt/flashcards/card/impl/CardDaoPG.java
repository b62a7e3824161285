package com.gt.flashcards.card.impl;

import com.gt.flashcards.card.CardDao;
import com.gt.flashcards.exception.MappingException;
import com.gt.flashcards.exception.PersistenceException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardReviewUpdate;
import com.gt.flashcards.serialization.ReviewDateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class CardDaoPG implements CardDao {

    private static final Logger log = LoggerFactory.getLogger(CardDaoPG.class);

    private static final String CARD_COLUMNS =
            "id, owner, question, answer, review_interval, ease_factor, last_review_date, next_review_date, created_at ";

    private static final String CREATE_CARD_SQL =
            "INSERT INTO flashcard (" + CARD_COLUMNS + ") " +
            "VALUES (:id, :owner, :question, :answer, :interval, :easeFactor, :lastReviewDate, :nextReviewDate, :createdAt)";

    private static final String LOAD_CARD_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM flashcard " +
            "WHERE id = :id AND owner = :owner";

    private static final String LOAD_ALL_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM flashcard " +
            "WHERE owner = :owner";

    private static final String UPDATE_CARD_REVIEW_SQL =
            "UPDATE flashcard " +
            "SET review_interval = :interval, ease_factor = :easeFactor, next_review_date = :nextReviewDate, last_review_date = :lastReviewDate " +
            "WHERE id = :id AND owner = :owner";

    private static final String DELETE_CARD_SQL =
            "DELETE FROM flashcard WHERE id = :id AND owner = :owner";

    private final NamedParameterJdbcTemplate template;
    private final ReviewDateCodec reviewDateCodec;
    private final RowMapper<Card> cardRowMapper;

    public CardDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ReviewDateCodec reviewDateCodec) {
        this.template = namedParameterJdbcTemplate;
        this.reviewDateCodec = reviewDateCodec;
        this.cardRowMapper = (rs, rowNum) -> getCardFromResultSet(rs, reviewDateCodec);
    }

    @Override
    public int createCard(Card card) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", card.id())
                .addValue("owner", card.owner())
                .addValue("question", card.question())
                .addValue("answer", card.answer())
                .addValue("interval", card.interval())
                .addValue("easeFactor", card.easeFactor())
                .addValue("lastReviewDate", reviewDateCodec.encodeReviewInstant(card.lastReviewDate()))
                .addValue("nextReviewDate", reviewDateCodec.encodeReviewDate(card.nextReviewDate()))
                .addValue("createdAt", Timestamp.from(card.createdAt()));

        try {
            return template.update(CREATE_CARD_SQL, params);
        } catch (DataAccessException ex) {
            throw persistenceFailure("create card " + card.id(), ex);
        }
    }

    @Override
    public Card loadCard(String cardId, String owner) {
        try {
            List<Card> cards = template.query(LOAD_CARD_SQL, Map.of("id", cardId, "owner", owner), cardRowMapper);

            return cards.isEmpty() ? null : cards.get(0);
        } catch (DataAccessException ex) {
            throw persistenceFailure("load card " + cardId, ex);
        }
    }

    @Override
    public List<Card> loadAllCards(String owner) {
        try {
            return template.query(LOAD_ALL_CARDS_SQL, Map.of("owner", owner), cardRowMapper);
        } catch (DataAccessException ex) {
            throw persistenceFailure("load cards for " + owner, ex);
        }
    }

    @Override
    public int updateCardReview(String cardId, String owner, CardReviewUpdate cardReviewUpdate) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", cardId)
                .addValue("owner", owner)
                .addValue("interval", cardReviewUpdate.interval())
                .addValue("easeFactor", cardReviewUpdate.easeFactor())
                .addValue("nextReviewDate", reviewDateCodec.encodeReviewDate(cardReviewUpdate.nextReviewDate()))
                .addValue("lastReviewDate", reviewDateCodec.encodeReviewInstant(cardReviewUpdate.lastReviewDate()));

        try {
            return template.update(UPDATE_CARD_REVIEW_SQL, params);
        } catch (DataAccessException ex) {
            throw persistenceFailure("update review for card " + cardId, ex);
        }
    }

    @Override
    public int deleteCard(String cardId, String owner) {
        try {
            return template.update(DELETE_CARD_SQL, Map.of("id", cardId, "owner", owner));
        } catch (DataAccessException ex) {
            throw persistenceFailure("delete card " + cardId, ex);
        }
    }

    private static PersistenceException persistenceFailure(String operation, DataAccessException ex) {
        String errMsg = "Failed to " + operation;

        log.error(errMsg, ex);
        return new PersistenceException(errMsg, ex);
    }

    static Card getCardFromResultSet(ResultSet rs, ReviewDateCodec reviewDateCodec) throws SQLException {
        String id = rs.getString("id");

        int interval = rs.getInt("review_interval");
        if (rs.wasNull()) {
            throw new MappingException("Card " + id + " has no interval");
        }
        double easeFactor = rs.getDouble("ease_factor");
        if (rs.wasNull()) {
            throw new MappingException("Card " + id + " has no ease factor");
        }

        return new Card(
                id,
                rs.getString("owner"),
                rs.getString("question"),
                rs.getString("answer"),
                interval,
                easeFactor,
                reviewDateCodec.decodeReviewInstant(rs.getString("last_review_date")),
                reviewDateCodec.decodeReviewDate(rs.getString("next_review_date")),
                toInstant(rs.getTimestamp("created_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
