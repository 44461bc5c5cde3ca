package com.williamcallahan.book_graph.repository;

/**
 * One row of the Postgres {@code authors} table, column for column.
 * Date columns carry whatever the driver returned ({@code java.sql.Date}, {@code LocalDate} or text).
 *
 * @param id null only for rows that are about to be inserted with a generated id
 */
public record AuthorRow(
    Long id,
    String firstname,
    String lastname,
    Object birthdate,
    Object deathdate,
    String favoritecolor,
    String bio,
    String nationality,
    Object datecreated
) {
}
