package pl.marcinmilkowski.string_analyzer.store;

import org.apache.lucene.document.IntPoint;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;

/**
 * Compiles the indexable part of a {@link FilterSet} into a Lucene query.
 *
 * <p>Palindrome flag, length bounds and word count become non-scoring FILTER clauses.
 * {@code contains_character} is case-insensitive substring containment, which the
 * index does not model; callers check it on the loaded records.</p>
 */
public class FilterQueryCompiler {

    public Query compile(FilterSet filters) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        boolean constrained = false;

        if (filters.isPalindrome() != null) {
            builder.add(new TermQuery(new Term(LuceneStringStore.FIELD_PALINDROME,
                filters.isPalindrome().toString())), BooleanClause.Occur.FILTER);
            constrained = true;
        }

        if (filters.minLength() != null || filters.maxLength() != null) {
            int lower = filters.minLength() != null ? filters.minLength() : Integer.MIN_VALUE;
            int upper = filters.maxLength() != null ? filters.maxLength() : Integer.MAX_VALUE;
            builder.add(IntPoint.newRangeQuery(LuceneStringStore.FIELD_LENGTH, lower, upper),
                BooleanClause.Occur.FILTER);
            constrained = true;
        }

        if (filters.wordCount() != null) {
            builder.add(IntPoint.newExactQuery(LuceneStringStore.FIELD_WORD_COUNT, filters.wordCount()),
                BooleanClause.Occur.FILTER);
            constrained = true;
        }

        return constrained ? builder.build() : new MatchAllDocsQuery();
    }
}
