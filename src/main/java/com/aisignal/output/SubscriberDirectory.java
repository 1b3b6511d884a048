package com.aisignal.output;

import com.aisignal.model.Subscriber;

import java.sql.SQLException;
import java.util.List;

/**
 * Subscriber lookups and the send log used by digest delivery.
 */
public interface SubscriberDirectory {

    List<Subscriber> listActive() throws SQLException;

    void logDigest(String email, int articleCount, String status, String error) throws SQLException;
}
