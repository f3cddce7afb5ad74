package io.easyrepo.demo.starter;

import io.easyrepo.jdbc.mapping.Constraint;
import io.easyrepo.jdbc.mapping.EntityMapping;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Entity mappings picked up by the easyrepo auto-configuration.
 */
@Configuration
public class LibraryMappings {

    @Bean
    public EntityMapping<Author> authorMapping() {
        return EntityMapping.builder(Author.class, "author")
                .factory(Author::new)
                .generatedId("id", Long.class, Author::getId, Author::setId)
                .column("name", String.class, Author::getName, Author::setName,
                        Constraint.required(), Constraint.maxLength(100))
                .oneToMany("books", Book.class, "author_id", Author::setBooks)
                .build();
    }

    @Bean
    public EntityMapping<Book> bookMapping() {
        return EntityMapping.builder(Book.class, "book")
                .factory(Book::new)
                .generatedId("id", Long.class, Book::getId, Book::setId)
                .column("author_id", Long.class, Book::getAuthorId, Book::setAuthorId, Constraint.required())
                .column("title", String.class, Book::getTitle, Book::setTitle,
                        Constraint.required(), Constraint.maxLength(200))
                .manyToOne("author", Author.class, Book::getAuthorId, Book::setAuthor)
                .build();
    }
}
