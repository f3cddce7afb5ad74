package io.easyrepo.demo.starter;

import io.easyrepo.CommitResult;
import io.easyrepo.Include;
import io.easyrepo.UnitOfWork;
import io.easyrepo.UnitOfWorkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class LibraryService {

    private static final Logger log = LoggerFactory.getLogger(LibraryService.class);

    private final UnitOfWorkFactory<Long> unitOfWorkFactory;

    public LibraryService(UnitOfWorkFactory<Long> unitOfWorkFactory) {
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    /**
     * Stores an author and their books in two transactions of one unit of work.
     */
    public Author publish(String authorName, String... titles) {
        Author author = new Author(authorName);
        try (UnitOfWork<Long> uow = unitOfWorkFactory.create()) {
            uow.beginTransaction();
            uow.repository().add(author);
            uow.commitTransaction();

            uow.beginTransaction();
            for (String title : titles) {
                uow.repository().add(new Book(author.getId(), title));
            }
            CommitResult result = uow.tryCommit();
            if (!result.isCommitted()) {
                log.warn("Books of {} were not stored: {}", authorName, result);
            }
        }
        log.info("Published author id={}, name={}, books={}", author.getId(), authorName, titles.length);
        return author;
    }

    public List<Author> catalog() {
        try (UnitOfWork<Long> uow = unitOfWorkFactory.create()) {
            return uow.repository().getListIncluding(Author.class, a -> true, Include.named("books"));
        }
    }

    public List<Book> booksMatching(String fragment) {
        try (UnitOfWork<Long> uow = unitOfWorkFactory.create()) {
            return uow.repository().getListIncluding(Book.class,
                    b -> b.getTitle().contains(fragment), Include.named("author"));
        }
    }

    public void withdraw(Long bookId) {
        try (UnitOfWork<Long> uow = unitOfWorkFactory.create()) {
            uow.beginTransaction();
            uow.repository().delete(Book.class, bookId);
            uow.commitTransaction();
        }
        log.info("Withdrew book id={}", bookId);
    }
}
