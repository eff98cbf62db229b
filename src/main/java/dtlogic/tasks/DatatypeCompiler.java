// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package dtlogic.tasks;

import static dtlogic.core.LogicFile.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dtlogic.core.LogicFile;
import dtlogic.core.LogicFile.Decl;
import dtlogic.core.LogicFile.Expr;
import dtlogic.lang.DatatypeFile.Datatype;
import dtlogic.lang.DatatypeFile.Path;
import dtlogic.lang.DatatypeFile.Type;
import dtlogic.lang.MonoType;
import dtlogic.lang.Specialization;

/**
 * Responsible for translating the datatypes and function types of a module into a stream of declarations and axioms
 * for the theorem prover. Every kind to be encoded (closure families, arrays, opaque instantiations and datatypes under
 * each of their specializations) becomes a single job. Jobs are encoded independently into their own buckets, which
 * are then merged in job order. As such, the stream produced does not depend upon whether or not jobs are encoded in
 * parallel.
 *
 * @author David J. Pearce
 *
 */
public class DatatypeCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(DatatypeCompiler.class);

    private final Context context;
    private final TypeTranslator translator;
    private final BoxingAxioms boxing;
    private final MembershipAxioms membership;
    private final FieldAxioms fields;
    private final ClosureAxioms closures;
    private final HeightAxioms heights;
    private final ExtEqualAxioms extEquals;

    /**
     * Flag to signal whether or not to encode jobs in parallel. By default this is disabled.
     */
    private boolean parallel;

    /**
     * Flag to signal whether or not to include heading comments in the stream. This is useful for debugging.
     */
    private boolean commentary;

    public DatatypeCompiler(Context context) {
        if (context == null) {
            throw new IllegalArgumentException("invalid context");
        }
        this.context = context;
        this.translator = new TypeTranslator(context);
        this.boxing = new BoxingAxioms();
        this.membership = new MembershipAxioms(context);
        this.fields = new FieldAxioms(translator);
        this.closures = new ClosureAxioms();
        this.heights = new HeightAxioms(translator);
        this.extEquals = new ExtEqualAxioms(translator);
    }

    public DatatypeCompiler setParallel(boolean flag) {
        this.parallel = flag;
        return this;
    }

    public DatatypeCompiler setCommentary(boolean flag) {
        this.commentary = flag;
        return this;
    }

    /**
     * Translate everything described by the context into a single stream of declarations.
     *
     * @return
     */
    public LogicFile compile() {
        List<Encoding> jobs = constructJobs();
        LOG.debug("Encoding {} jobs for {}", jobs.size(), context.getModule());
        List<Commands> encoded;
        if (parallel) {
            encoded = jobs.parallelStream().map(this::encode).collect(Collectors.toList());
        } else {
            encoded = jobs.stream().map(this::encode).collect(Collectors.toList());
        }
        // Merge in job order
        Commands all = new Commands();
        for (Commands c : encoded) {
            all.append(c);
        }
        for (Map.Entry<Path, Integer> e : context.getFnDefs().entrySet()) {
            all.getTokens().add(MembershipAxioms.constructToken(Naming.fnDef(e.getKey()), e.getValue()));
        }
        return new LogicFile(constructStream(all));
    }

    /**
     * Concatenate the buckets into the final order of the stream.
     *
     * @param all
     * @return
     */
    private List<Decl> constructStream(Commands all) {
        ArrayList<Decl> decls = new ArrayList<>();
        addSection("SORTS", all.getSorts(), decls);
        if (!all.getDatatypes().isEmpty()) {
            addSection("DATATYPES", Collections.singletonList(new Decl.Datatypes(all.getDatatypes())), decls);
        }
        addSection("FIELDS", all.getFields(), decls);
        addSection("TYPE IDENTIFIERS", all.getTokens(), decls);
        addSection("BOXING", all.getBoxes(), decls);
        addSection("AXIOMS", all.getAxioms(), decls);
        if (context.usesArray()) {
            addSection("ARRAYS", Prelude.arrayFunctions(Naming.box(ARRAY)), decls);
        }
        MonoType strslice = MonoType.Primitive(Type.PrimitiveKind.STRSLICE);
        if (context.getMonoTypes().contains(strslice)) {
            addSection("STRING SLICES", Prelude.strSliceFunctions(Naming.monotype(strslice)), decls);
        }
        return decls;
    }

    private void addSection(String heading, List<? extends Decl> section, List<Decl> decls) {
        if (commentary && !section.isEmpty()) {
            decls.addAll(constructCommentHeading(heading));
        }
        decls.addAll(section);
    }

    // ==============================================================================
    // Jobs
    // ==============================================================================

    private static final String ARRAY = "array";

    /**
     * Construct the list of jobs to encode. The order of this list determines the order of declarations within each
     * part of the stream.
     *
     * @return
     */
    private List<Encoding> constructJobs() {
        ArrayList<Encoding> jobs = new ArrayList<>();
        for (int arity : context.getClosureArities()) {
            jobs.add(new Encoding.Builder(new EncodedKind.FnSpec(arity), Naming.closure(arity), SORT(Naming.FUN))
                    .setTypeParameters(ClosureAxioms.typeParameters(arity)).setDeclareBox(true).setAddExtEqual(true)
                    .build());
        }
        if (context.usesArray()) {
            List<String> params = Arrays.asList("T", "N");
            Expr id = INVOKE(Naming.typeId(ARRAY), VAR(Naming.typeParameter("T")), VAR(Naming.typeParameter("N")));
            jobs.add(new Encoding.Builder(EncodedKind.ARRAY, ARRAY, SORT(Naming.FUN)).setTypeParameters(params)
                    .setTypeId(id).setDeclareBox(true).build());
        }
        for (MonoType m : context.getMonoTypes()) {
            String path = Naming.monotype(m);
            jobs.add(new Encoding.Builder(new EncodedKind.Monotype(m), path, SORT(path))
                    .setTypeId(translator.typeId(m.toType())).setDeclareBox(true).build());
        }
        for (Datatype d : context.getDatatypes()) {
            if (!context.isTransparent(d)) {
                // Nothing is known about the structure, only its identity
                String path = Naming.datatype(d.getName(), Specialization.GENERIC);
                jobs.add(new Encoding.Builder(new EncodedKind.Dt(d), path, SORT(Naming.POLY))
                        .setTypeParameters(d.getTypeParameters()).build());
                continue;
            }
            List<Specialization> specializations = context.getSpecializations(d.getName());
            if (specializations.isEmpty()) {
                specializations = Collections.singletonList(Specialization.GENERIC);
            }
            for (Specialization s : specializations) {
                String path = Naming.datatype(d.getName(), s);
                jobs.add(new Encoding.Builder(new EncodedKind.Dt(d), path, SORT(path)).setSpecialization(s)
                        .setTypeParameters(s.keptParameters(d.getTypeParameters())).setVariants(d.getVariants())
                        .setDeclareBox(true).setAddHeight(s.isEmpty())
                        .setAddExtEqual(d.isExtEqual() && s.isEmpty()).build());
            }
        }
        return jobs;
    }

    /**
     * Encode a single job into its own buckets.
     *
     * @param enc
     * @return
     */
    private Commands encode(Encoding enc) {
        LOG.debug("Encoding {} ({})", enc, enc.getTypeId());
        Commands out = new Commands();
        EncodedKind kind = enc.getKind();
        switch (kind.getOpcode()) {
        case EncodedKind.KIND_datatype: {
            Datatype d = ((EncodedKind.Dt) kind).getDatatype();
            if (!enc.getVariants().isEmpty()) {
                out.getDatatypes().add(fields.constructDatatype(enc, d));
            } else if (context.isTransparent(d)) {
                // No constructors, hence no values
                out.getSorts().add(new Decl.Sort(enc.getPath()));
            }
            boxing.encode(enc, out);
            membership.encode(enc, out);
            fields.encode(enc, d, out);
            heights.encode(enc, out);
            break;
        }
        case EncodedKind.KIND_monotype:
            out.getSorts().add(new Decl.Sort(enc.getPath()));
            boxing.encode(enc, out);
            membership.encode(enc, out);
            break;
        case EncodedKind.KIND_closure:
            boxing.encode(enc, out);
            membership.encode(enc, out);
            closures.encode(enc, ((EncodedKind.FnSpec) kind).getArity(), out);
            break;
        case EncodedKind.KIND_array:
            boxing.encode(enc, out);
            membership.encode(enc, out);
            break;
        default:
            throw new IllegalArgumentException("unknown kind encountered (" + kind + ")");
        }
        extEquals.encode(enc, out);
        if (commentary && !out.getAxioms().isEmpty()) {
            out.getAxioms().addAll(0, constructCommentSubheading(enc.toString()));
        }
        return out;
    }

    // ==============================================================================
    // Commentary
    // ==============================================================================

    private static List<Decl> constructCommentHeading(String text) {
        ArrayList<Decl> decls = new ArrayList<>();
        decls.add(null);
        decls.add(new Decl.LineComment(separator('=', 80)));
        decls.add(new Decl.LineComment(text));
        decls.add(new Decl.LineComment(separator('=', 80)));
        return decls;
    }

    private static List<Decl> constructCommentSubheading(String text) {
        ArrayList<Decl> decls = new ArrayList<>();
        decls.add(null);
        decls.add(new Decl.LineComment(text));
        decls.add(new Decl.LineComment(separator('-', 80)));
        return decls;
    }

    private static String separator(char c, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i != n; ++i) {
            sb.append(c);
        }
        return sb.toString();
    }
}
