package com.skypulse.engine.repository;

import com.skypulse.engine.util.DataTypeConverter;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Field encodings shared by the Mongo adapters.
 * - Instants as Mongo dates ({"$date": ISO-8601})
 * - LocalDates read from ISO strings
 * - Prices as plain decimal strings, so no binary rounding reaches the store
 */
final class MongoDocuments {

    static final String ID = "_id";

    private MongoDocuments() {
    }

    /**
     * String id, whether stored as a string or as an ObjectId ({"$oid": ...}).
     */
    static String id(JsonObject doc) {
        Object value = doc.getValue(ID);
        if (value instanceof JsonObject) {
            return ((JsonObject) value).getString("$oid");
        }
        return value == null ? null : value.toString();
    }

    static JsonObject date(Instant instant) {
        return instant == null ? null : new JsonObject().put("$date", instant.toString());
    }

    static String price(BigDecimal price) {
        return price == null ? null : price.toPlainString();
    }

    static BigDecimal price(JsonObject doc, String field) {
        return DataTypeConverter.toBigDecimal(doc.getValue(field));
    }

    static LocalDate day(JsonObject doc, String field) {
        return DataTypeConverter.toLocalDate(doc.getString(field));
    }
}
