package io.catalogsync.source;

import io.catalogsync.domain.CatalogIndex;
import io.catalogsync.domain.Course;
import io.catalogsync.domain.RemoteFileEntry;
import io.catalogsync.domain.Session;

import java.util.List;
import java.util.Map;

/**
 * Read access to the remote catalog. Every call is one blocking round-trip.
 */
public interface CatalogBrowser {

    /**
     * Academic years the user is enrolled in, label to year key.
     */
    Map<String, String> listYears(Session session) throws FetchException;

    List<Course> listCourses(String yearKey, Session session) throws FetchException;

    CatalogIndex listCategoryIndex(Course course) throws FetchException;

    List<RemoteFileEntry> listCategoryFiles(Course course, String categoryId) throws FetchException;
}
