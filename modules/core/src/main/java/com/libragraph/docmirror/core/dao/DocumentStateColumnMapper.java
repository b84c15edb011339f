package com.libragraph.docmirror.core.dao;

import com.libragraph.docmirror.core.document.DocumentState;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class DocumentStateColumnMapper implements ColumnMapper<DocumentState> {

    @Override
    public DocumentState map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String label = r.getString(columnNumber);
        return label == null ? null : DocumentState.fromLabel(label);
    }
}
