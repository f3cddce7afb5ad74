package io.easyrepo.demo.starter;

import io.easyrepo.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class LibraryRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(LibraryRunner.class);

    private final LibraryService library;

    public LibraryRunner(LibraryService library) {
        this.library = library;
    }

    @Override
    public void run(String... args) {
        library.publish("Ursula K. Le Guin", "A Wizard of Earthsea", "The Dispossessed");
        library.publish("Frank Herbert", "Dune");

        for (Author author : library.catalog()) {
            log.info("[Catalog] {} ({} books)", author.getName(), author.getBooks().size());
        }

        for (Book book : library.booksMatching("The")) {
            log.info("[Search] '{}' by {}", book.getTitle(), book.getAuthor().getName());
            library.withdraw(book.getId());
        }

        try {
            library.withdraw(-1L);
        } catch (EntityNotFoundException e) {
            log.info("[Withdraw] {}", e.getMessage());
        }
    }
}
