package com.gt.flashcards.card;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardReviewUpdate;

import java.util.List;

public interface CardDao {

    int createCard(Card card);

    Card loadCard(String cardId, String owner);

    List<Card> loadAllCards(String owner);

    int updateCardReview(String cardId, String owner, CardReviewUpdate cardReviewUpdate);

    int deleteCard(String cardId, String owner);
}
