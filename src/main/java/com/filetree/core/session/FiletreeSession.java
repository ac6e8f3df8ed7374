package com.filetree.core.session;

import com.filetree.config.ExportSettings;
import com.filetree.core.export.DocumentBuilder;
import com.filetree.core.export.DocumentExporter;
import com.filetree.core.filter.PathFilter;
import com.filetree.core.tree.TreeModel;
import com.filetree.core.tree.TreeWalker;

/**
 * The components of one export session, wired around a single
 * {@link ExportSettings} value. The tree model starts with the root populated.
 */
public record FiletreeSession(
        ExportSettings settings,
        PathFilter filter,
        TreeWalker walker,
        TreeModel model,
        DocumentBuilder builder,
        DocumentExporter exporter
) {

    public static FiletreeSession open(ExportSettings settings) {
        var filter = new PathFilter(settings);
        var walker = new TreeWalker(filter);
        var model = new TreeModel(walker);
        model.populate(model.root());
        var builder = new DocumentBuilder(settings, walker, model);
        var exporter = new DocumentExporter(settings, builder);
        return new FiletreeSession(settings, filter, walker, model, builder, exporter);
    }
}
